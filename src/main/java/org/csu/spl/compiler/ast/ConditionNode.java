package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: 布尔连接 (AND / OR)，只有二元形式
 * e.g., time.hour > 9 AND time.hour < 17
 */
public record ConditionNode(
        Operator operator,
        BooleanExpressionNode left,
        BooleanExpressionNode right,
        int line
) implements BooleanExpressionNode {

    public enum Operator implements Symbolic {
        AND, OR;

        @Override
        public String symbol() {
            return name();
        }
    }

    public ConditionNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCondition(this);
    }
}
