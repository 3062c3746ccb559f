package org.csu.spl.compiler.ast;

/**
 * AST 节点: 用户定义，role 只是名字引用，这里不做解析
 * e.g., USER JaneDoe {role: Developer}
 */
public record UserDefNode(String name, String role, int line) implements DeclarationNode {

    public UserDefNode {
        Checks.name(name, "name");
        Checks.name(role, "role");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUserDef(this);
    }
}
