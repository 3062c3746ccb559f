package org.csu.spl.compiler.ast;

/**
 * 顶层声明：ROLE / USER / RESOURCE / ALLOW / DENY
 */
public sealed interface DeclarationNode extends AstNode
        permits RoleDefNode, UserDefNode, ResourceDefNode, PolicyNode {
}
