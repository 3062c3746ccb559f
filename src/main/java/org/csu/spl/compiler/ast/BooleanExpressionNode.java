package org.csu.spl.compiler.ast;

/**
 * 可以作为策略条件根节点的表达式：布尔连接 (AND/OR) 或比较。
 */
public sealed interface BooleanExpressionNode extends AstNode permits ConditionNode, ComparisonNode {
}
