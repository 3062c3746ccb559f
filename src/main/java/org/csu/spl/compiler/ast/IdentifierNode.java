package org.csu.spl.compiler.ast;

/**
 * AST 节点: 标识符, e.g., Admin, DB_Finance
 */
public record IdentifierNode(String value, int line) implements ExpressionNode {

    public IdentifierNode {
        Checks.name(value, "value");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
