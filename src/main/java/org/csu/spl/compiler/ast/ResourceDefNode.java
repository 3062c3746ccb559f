package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: 资源定义
 * e.g., RESOURCE DB_Finance {path: "/data/financial"}
 */
public record ResourceDefNode(String name, String path, int line) implements DeclarationNode {

    public ResourceDefNode {
        Checks.name(name, "name");
        Objects.requireNonNull(path, "path");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitResourceDef(this);
    }
}
