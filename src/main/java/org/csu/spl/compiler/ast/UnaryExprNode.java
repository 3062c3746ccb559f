package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: 一元正负号, e.g., -5
 */
public record UnaryExprNode(Operator operator, ExpressionNode operand, int line) implements ExpressionNode {

    public enum Operator implements Symbolic {
        PLUS("+"), MINUS("-");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String symbol() {
            return symbol;
        }
    }

    public UnaryExprNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
