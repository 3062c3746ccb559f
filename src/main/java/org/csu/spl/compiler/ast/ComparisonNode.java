package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: 比较表达式
 * e.g., time.hour > 9, user.role == Admin
 */
public record ComparisonNode(
        Operator operator,
        ExpressionNode left,
        ExpressionNode right,
        int line
) implements BooleanExpressionNode {

    public enum Operator implements Symbolic {
        EQ("=="), NE("!="), LT("<"), GT(">"), LE("<="), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        @Override
        public String symbol() {
            return symbol;
        }
    }

    public ComparisonNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}
