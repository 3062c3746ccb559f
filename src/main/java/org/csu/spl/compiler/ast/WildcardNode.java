package org.csu.spl.compiler.ast;

/**
 * AST 节点: 通配符 '*'。
 * 与内容为 "*" 的 {@link StringLiteralNode} 是不同的节点类型，避免二者被混用。
 */
public record WildcardNode(int line) implements ExpressionNode {

    public WildcardNode {
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWildcard(this);
    }
}
