package org.csu.spl.compiler.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST 根节点: 按源码顺序保存所有声明
 */
public record ProgramNode(List<DeclarationNode> declarations, int line) implements AstNode {

    public ProgramNode {
        declarations = List.copyOf(Objects.requireNonNull(declarations, "declarations"));
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
