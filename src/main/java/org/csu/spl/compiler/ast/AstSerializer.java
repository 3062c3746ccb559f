package org.csu.spl.compiler.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把 AST 投影为有序的通用 Map，供 JSON 等交换格式使用。
 * 每个 Map 至少包含 {@code type} 和 {@code line}，其余键由节点类型决定。
 * 纯函数，不做校验，不会失败。
 */
public final class AstSerializer {

    public static final String TYPE_KEY = "type";
    public static final String LINE_KEY = "line";

    private AstSerializer() {
    }

    /**
     * @return 节点对应的 Map；node 为 null 时返回 null
     */
    public static Map<String, Object> toMap(AstNode node) {
        if (node == null) {
            return null;
        }
        NodeShape shape = NodeShapes.of(node);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(TYPE_KEY, shape.type());
        result.put(LINE_KEY, shape.line());
        for (NodeShape.Field field : shape.fields()) {
            result.put(field.key(), field.value() instanceof List<?> list ? new ArrayList<>(list) : field.value());
        }
        for (NodeShape.Slot slot : shape.children()) {
            if (slot.many()) {
                List<Map<String, Object>> items = new ArrayList<>();
                for (AstNode child : slot.nodes()) {
                    items.add(toMap(child));
                }
                result.put(slot.key(), items);
            } else {
                result.put(slot.key(), toMap(slot.nodes().get(0)));
            }
        }
        return result;
    }
}
