package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: 二元算术表达式
 * e.g., 3 + 4 * 10, time.hour * 2 + 5
 */
public record ArithmeticExprNode(
        Operator operator,
        ExpressionNode left,
        ExpressionNode right,
        int line
) implements ExpressionNode {

    public enum Operator implements Symbolic {
        ADD("+"), SUB("-"), MUL("*"), DIV("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String symbol() {
            return symbol;
        }
    }

    public ArithmeticExprNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }
}
