package org.csu.spl.compiler.ast;

/**
 * AST 节点: 整数字面量。负数由 {@link UnaryExprNode} 表示。
 */
public record NumberNode(long value, int line) implements ExpressionNode {

    public NumberNode {
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
