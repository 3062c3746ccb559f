package org.csu.spl.compiler.ast;

/**
 * @author hidyouth
 * @description: 所有 AST 节点的公共接口
 *
 * 节点集合是封闭的；新增节点类型必须同时扩展 {@link AstVisitor}，
 * 打印器和序列化器因此不会漏掉任何节点。
 * {@code line} 只用于诊断，不参与树的语义。
 */
public sealed interface AstNode permits ProgramNode, DeclarationNode, BooleanExpressionNode, ExpressionNode {

    int line();

    <R> R accept(AstVisitor<R> visitor);
}
