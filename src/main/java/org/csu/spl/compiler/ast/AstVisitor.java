package org.csu.spl.compiler.ast;

/**
 * AST 访问者，每种节点对应一个方法。
 *
 * @param <R> 访问结果类型
 */
public interface AstVisitor<R> {

    R visitProgram(ProgramNode node);

    R visitRoleDef(RoleDefNode node);

    R visitUserDef(UserDefNode node);

    R visitResourceDef(ResourceDefNode node);

    R visitPolicy(PolicyNode node);

    R visitCondition(ConditionNode node);

    R visitComparison(ComparisonNode node);

    R visitArithmetic(ArithmeticExprNode node);

    R visitUnary(UnaryExprNode node);

    R visitAttributeAccess(AttributeAccessNode node);

    R visitIdentifier(IdentifierNode node);

    R visitNumber(NumberNode node);

    R visitStringLiteral(StringLiteralNode node);

    R visitWildcard(WildcardNode node);
}
