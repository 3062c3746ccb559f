package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: 角色定义
 * e.g., ROLE Admin {can: *}
 */
public record RoleDefNode(String name, ActionList actions, int line) implements DeclarationNode {

    public RoleDefNode {
        Checks.name(name, "name");
        Objects.requireNonNull(actions, "actions");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRoleDef(this);
    }
}
