package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: 字符串字面量 (不含引号), e.g., "/data/financial"
 */
public record StringLiteralNode(String value, int line) implements ExpressionNode {

    public StringLiteralNode {
        Objects.requireNonNull(value, "value");
        Checks.line(line);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
