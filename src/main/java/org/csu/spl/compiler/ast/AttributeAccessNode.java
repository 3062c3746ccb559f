package org.csu.spl.compiler.ast;

/**
 * AST 节点: 点号属性访问, e.g., time.hour, user.role
 */
public record AttributeAccessNode(String object, String attribute, int line) implements ExpressionNode {

    public AttributeAccessNode {
        Checks.name(object, "object");
        Checks.name(attribute, "attribute");
        Checks.line(line);
    }

    public String fullName() {
        return object + "." + attribute;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAttributeAccess(this);
    }
}
