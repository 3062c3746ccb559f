package org.csu.spl.compiler.ast;

/**
 * 比较运算两侧的值表达式：算术、一元、属性访问与字面量。
 */
public sealed interface ExpressionNode extends AstNode
        permits ArithmeticExprNode, UnaryExprNode, AttributeAccessNode,
        IdentifierNode, NumberNode, StringLiteralNode, WildcardNode {
}
