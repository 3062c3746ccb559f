package org.csu.spl.compiler.ast;

import org.csu.spl.common.exception.AstFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: {@link AstSerializer} 的逆操作，把通用 Map 还原为 AST
 *
 * 用于读回导出的 JSON。未知类型、缺失的键或类型不符的值都会抛出 {@link AstFormatException}。
 */
public final class AstMapReader {

    private AstMapReader() {
    }

    public static AstNode read(Map<String, ?> map) {
        if (map == null) {
            return null;
        }
        String type = string(map, "node", AstSerializer.TYPE_KEY);
        int line = line(map, type);
        try {
            return switch (type) {
                case "ProgramNode" -> new ProgramNode(declarations(map, type), line);
                case "RoleDefNode" -> new RoleDefNode(string(map, type, "name"), actions(map, type), line);
                case "UserDefNode" -> new UserDefNode(string(map, type, "name"), string(map, type, "role"), line);
                case "ResourceDefNode" ->
                        new ResourceDefNode(string(map, type, "name"), string(map, type, "path"), line);
                case "PolicyNode" -> new PolicyNode(
                        symbol(PolicyNode.Kind.class, map, type, "policy_type"),
                        actions(map, type),
                        string(map, type, "resources"),
                        map.containsKey("condition") ? booleanExpression(map, type, "condition") : null,
                        line);
                case "ConditionNode" -> new ConditionNode(
                        symbol(ConditionNode.Operator.class, map, type, "operator"),
                        booleanExpression(map, type, "left"),
                        booleanExpression(map, type, "right"),
                        line);
                case "ComparisonNode" -> new ComparisonNode(
                        symbol(ComparisonNode.Operator.class, map, type, "operator"),
                        expression(map, type, "left"),
                        expression(map, type, "right"),
                        line);
                case "ArithmeticExprNode" -> new ArithmeticExprNode(
                        symbol(ArithmeticExprNode.Operator.class, map, type, "operator"),
                        expression(map, type, "left"),
                        expression(map, type, "right"),
                        line);
                case "UnaryExprNode" -> new UnaryExprNode(
                        symbol(UnaryExprNode.Operator.class, map, type, "operator"),
                        expression(map, type, "operand"),
                        line);
                case "AttributeAccessNode" ->
                        new AttributeAccessNode(string(map, type, "object"), string(map, type, "attribute"), line);
                case "IdentifierNode" -> new IdentifierNode(string(map, type, "value"), line);
                case "NumberNode" -> new NumberNode(number(map, type, "value"), line);
                case "StringLiteralNode" -> new StringLiteralNode(string(map, type, "value"), line);
                case "WildcardNode" -> new WildcardNode(line);
                default -> throw new AstFormatException("Unknown node type '" + type + "'");
            };
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new AstFormatException("Invalid " + type + " at line " + line + ": " + e.getMessage(), e);
        }
    }

    private static List<DeclarationNode> declarations(Map<String, ?> map, String type) {
        List<DeclarationNode> declarations = new ArrayList<>();
        for (Object item : list(map, type, "declarations")) {
            AstNode node = read(asMap(item, type, "declarations"));
            if (!(node instanceof DeclarationNode declaration)) {
                throw new AstFormatException(type, "declarations", "declaration nodes");
            }
            declarations.add(declaration);
        }
        return declarations;
    }

    private static ActionList actions(Map<String, ?> map, String type) {
        List<String> names = new ArrayList<>();
        for (Object item : list(map, type, "actions")) {
            if (!(item instanceof String name)) {
                throw new AstFormatException(type, "actions", "a list of strings");
            }
            names.add(name);
        }
        if (names.equals(List.of(ActionList.WILDCARD_SYMBOL))) {
            return ActionList.wildcard();
        }
        return ActionList.of(names);
    }

    private static BooleanExpressionNode booleanExpression(Map<String, ?> map, String type, String key) {
        AstNode node = read(asMap(map.get(key), type, key));
        if (!(node instanceof BooleanExpressionNode expression)) {
            throw new AstFormatException(type, key, "a ConditionNode or ComparisonNode");
        }
        return expression;
    }

    private static ExpressionNode expression(Map<String, ?> map, String type, String key) {
        AstNode node = read(asMap(map.get(key), type, key));
        if (!(node instanceof ExpressionNode expression)) {
            throw new AstFormatException(type, key, "a value expression");
        }
        return expression;
    }

    private static <E extends Enum<E> & Symbolic> E symbol(Class<E> enumType, Map<String, ?> map,
                                                           String type, String key) {
        return Symbolic.fromSymbol(enumType, string(map, type, key));
    }

    private static int line(Map<String, ?> map, String type) {
        long line = number(map, type, AstSerializer.LINE_KEY);
        if (line < 0 || line > Integer.MAX_VALUE) {
            throw new AstFormatException(type, AstSerializer.LINE_KEY, "a non-negative int");
        }
        return (int) line;
    }

    private static String string(Map<String, ?> map, String type, String key) {
        if (!(map.get(key) instanceof String value)) {
            throw new AstFormatException(type, key, "a string");
        }
        return value;
    }

    private static long number(Map<String, ?> map, String type, String key) {
        Object value = map.get(key);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new AstFormatException(type, key, "an integer");
    }

    private static List<?> list(Map<String, ?> map, String type, String key) {
        if (!(map.get(key) instanceof List<?> value)) {
            throw new AstFormatException(type, key, "a list");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asMap(Object value, String type, String key) {
        if (!(value instanceof Map<?, ?>)) {
            throw new AstFormatException(type, key, "a node object");
        }
        return (Map<String, ?>) value;
    }
}
