package org.csu.spl.compiler.ast;

import java.util.List;

/**
 * 一个节点的通用描述：类型名、行号、标量字段 (按导出顺序) 和子节点槽位。
 * {@link AstPrinter} 与 {@link AstSerializer} 都基于这份描述工作。
 *
 * @param type     节点类型名，即导出时的 {@code type}
 * @param line     行号
 * @param fields   标量字段, 值为 String / Long / List&lt;String&gt;
 * @param children 子节点槽位, 缺失的可选子节点不出现
 */
public record NodeShape(String type, int line, List<Field> fields, List<Slot> children) {

    public record Field(String key, Object value) {
    }

    /**
     * @param key   导出时的键名
     * @param label 打印时放在分支符号后面的标签，可以为 null
     * @param nodes 槽位中的节点
     * @param many  true 表示导出为列表 (如 declarations)，false 表示单个节点
     */
    public record Slot(String key, String label, List<? extends AstNode> nodes, boolean many) {

        static Slot single(String key, AstNode node) {
            return new Slot(key, null, List.of(node), false);
        }

        static Slot labelled(String key, String label, AstNode node) {
            return new Slot(key, label, List.of(node), false);
        }

        static Slot list(String key, List<? extends AstNode> nodes) {
            return new Slot(key, null, nodes, true);
        }
    }
}
