package org.csu.spl.compiler.ast;

import java.util.Objects;

/**
 * AST 节点: ALLOW / DENY 策略
 * e.g., ALLOW action: read, write ON resource: DB_Finance IF (time.hour > 9)
 *
 * @param condition 可选条件, 没有 IF 子句时为 null
 */
public record PolicyNode(
        Kind kind,
        ActionList actions,
        String resources,
        BooleanExpressionNode condition,
        int line
) implements DeclarationNode {

    public enum Kind implements Symbolic {
        ALLOW, DENY;

        @Override
        public String symbol() {
            return name();
        }
    }

    public PolicyNode {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(actions, "actions");
        Checks.name(resources, "resources");
        Checks.line(line);
    }

    public PolicyNode(Kind kind, ActionList actions, String resources, int line) {
        this(kind, actions, resources, null, line);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitPolicy(this);
    }
}
