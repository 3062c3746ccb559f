package org.csu.spl.compiler.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 每种节点的字段与子节点定义都在这里，且只在这里。
 */
public final class NodeShapes implements AstVisitor<NodeShape> {

    public static final NodeShapes INSTANCE = new NodeShapes();

    private NodeShapes() {
    }

    public static NodeShape of(AstNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public NodeShape visitProgram(ProgramNode node) {
        return shape(node, List.of(), List.of(NodeShape.Slot.list("declarations", node.declarations())));
    }

    @Override
    public NodeShape visitRoleDef(RoleDefNode node) {
        return shape(node, List.of(
                field("name", node.name()),
                field("actions", node.actions().toList())), List.of());
    }

    @Override
    public NodeShape visitUserDef(UserDefNode node) {
        return shape(node, List.of(
                field("name", node.name()),
                field("role", node.role())), List.of());
    }

    @Override
    public NodeShape visitResourceDef(ResourceDefNode node) {
        return shape(node, List.of(
                field("name", node.name()),
                field("path", node.path())), List.of());
    }

    @Override
    public NodeShape visitPolicy(PolicyNode node) {
        List<NodeShape.Slot> children = new ArrayList<>();
        if (node.hasCondition()) {
            children.add(NodeShape.Slot.labelled("condition", "condition: ", node.condition()));
        }
        return shape(node, List.of(
                field("policy_type", node.kind().symbol()),
                field("actions", node.actions().toList()),
                field("resources", node.resources())), children);
    }

    @Override
    public NodeShape visitCondition(ConditionNode node) {
        return binary(node, node.operator(), node.left(), node.right());
    }

    @Override
    public NodeShape visitComparison(ComparisonNode node) {
        return binary(node, node.operator(), node.left(), node.right());
    }

    @Override
    public NodeShape visitArithmetic(ArithmeticExprNode node) {
        return binary(node, node.operator(), node.left(), node.right());
    }

    @Override
    public NodeShape visitUnary(UnaryExprNode node) {
        return shape(node, List.of(field("operator", node.operator().symbol())),
                List.of(NodeShape.Slot.single("operand", node.operand())));
    }

    @Override
    public NodeShape visitAttributeAccess(AttributeAccessNode node) {
        return shape(node, List.of(
                field("object", node.object()),
                field("attribute", node.attribute())), List.of());
    }

    @Override
    public NodeShape visitIdentifier(IdentifierNode node) {
        return shape(node, List.of(field("value", node.value())), List.of());
    }

    @Override
    public NodeShape visitNumber(NumberNode node) {
        return shape(node, List.of(field("value", node.value())), List.of());
    }

    @Override
    public NodeShape visitStringLiteral(StringLiteralNode node) {
        return shape(node, List.of(field("value", node.value())), List.of());
    }

    @Override
    public NodeShape visitWildcard(WildcardNode node) {
        return shape(node, List.of(field("value", ActionList.WILDCARD_SYMBOL)), List.of());
    }

    private static NodeShape binary(AstNode node, Symbolic operator, AstNode left, AstNode right) {
        return shape(node, List.of(field("operator", operator.symbol())), List.of(
                NodeShape.Slot.single("left", left),
                NodeShape.Slot.single("right", right)));
    }

    private static NodeShape shape(AstNode node, List<NodeShape.Field> fields, List<NodeShape.Slot> children) {
        return new NodeShape(node.getClass().getSimpleName(), node.line(), fields, children);
    }

    private static NodeShape.Field field(String key, Object value) {
        return new NodeShape.Field(key, value);
    }
}
