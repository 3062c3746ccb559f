package org.csu.spl.compiler.ast;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 以缩进树的形式打印 AST，便于调试
 *
 * 前序深度优先遍历，每个节点一行：每层缩进两个空格，非最后一个兄弟节点前缀为 "├── "，
 * 最后一个为 "└── "。列表类字段 (如角色的动作) 折叠在节点自身的摘要里，不展开为子节点。
 */
public final class AstPrinter {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String INDENT = "  ";

    private AstPrinter() {
    }

    public static void print(AstNode root) {
        print(root, System.out);
    }

    public static void print(AstNode root, PrintStream out) {
        out.print(render(root));
        out.flush();
    }

    /**
     * @return 渲染结果，每行以 '\n' 结尾；root 为 null 时返回空串
     */
    public static String render(AstNode root) {
        StringBuilder sb = new StringBuilder();
        render(root, 0, "", sb);
        return sb.toString();
    }

    private static void render(AstNode node, int depth, String prefix, StringBuilder sb) {
        if (node == null) {
            return;
        }
        NodeShape shape = NodeShapes.of(node);
        sb.append(INDENT.repeat(depth)).append(prefix).append(summary(shape)).append('\n');

        List<String> labels = new ArrayList<>();
        List<AstNode> children = new ArrayList<>();
        for (NodeShape.Slot slot : shape.children()) {
            for (AstNode child : slot.nodes()) {
                labels.add(slot.label() == null ? "" : slot.label());
                children.add(child);
            }
        }
        for (int i = 0; i < children.size(); i++) {
            String branch = i == children.size() - 1 ? LAST_BRANCH : BRANCH;
            render(children.get(i), depth + 1, branch + labels.get(i), sb);
        }
    }

    /**
     * 节点的单行摘要, e.g., {@code RoleDefNode(name='Admin', actions=[*])}
     */
    static String summary(NodeShape shape) {
        List<String> parts = new ArrayList<>();
        for (NodeShape.Field field : shape.fields()) {
            parts.add(field.key() + "=" + formatValue(field.value()));
        }
        for (NodeShape.Slot slot : shape.children()) {
            if (slot.many()) {
                parts.add(slot.nodes().size() + " " + slot.key());
            }
        }
        return shape.type() + "(" + String.join(", ", parts) + ")";
    }

    private static String formatValue(Object value) {
        if (value instanceof String text) {
            return "'" + text + "'";
        }
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>();
            for (Object item : list) {
                items.add(String.valueOf(item));
            }
            return "[" + String.join(", ", items) + "]";
        }
        return String.valueOf(value);
    }
}
