package org.csu.spl.compiler.ast;

import java.util.List;
import java.util.Objects;

/**
 * ROLE 的 {@code can} 和策略的 {@code action} 字段：要么是通配符 (全部动作)，
 * 要么是一个非空的动作名列表，二者不会混合。
 * 源码层面允许 {@code can: read, *} 这样的写法，由 {@link #fromSurface} 统一解释为通配符。
 */
public final class ActionList {

    public static final String WILDCARD_SYMBOL = "*";

    private static final ActionList WILDCARD = new ActionList(List.of());

    private final List<String> names;

    private ActionList(List<String> names) {
        this.names = names;
    }

    public static ActionList wildcard() {
        return WILDCARD;
    }

    public static ActionList of(String... names) {
        return of(List.of(names));
    }

    public static ActionList of(List<String> names) {
        Objects.requireNonNull(names, "names");
        if (names.isEmpty()) {
            throw new IllegalArgumentException("action list must not be empty");
        }
        for (String name : names) {
            Checks.name(name, "action name");
            if (WILDCARD_SYMBOL.equals(name)) {
                throw new IllegalArgumentException("use ActionList.wildcard() instead of the name '*'");
            }
        }
        return new ActionList(List.copyOf(names));
    }

    /**
     * 解释源码中的动作列表：只要出现过 '*'，整个列表即为通配符。
     */
    public static ActionList fromSurface(List<String> names, boolean wildcardSeen) {
        return wildcardSeen ? WILDCARD : of(names);
    }

    public boolean isWildcard() {
        return this == WILDCARD;
    }

    /**
     * @return 动作名列表；通配符返回空列表
     */
    public List<String> names() {
        return names;
    }

    /**
     * 导出形式：通配符为 {@code ["*"]}，否则为动作名列表。
     */
    public List<String> toList() {
        return isWildcard() ? List.of(WILDCARD_SYMBOL) : names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionList that = (ActionList) o;
        return isWildcard() == that.isWildcard() && names.equals(that.names);
    }

    @Override
    public int hashCode() {
        return isWildcard() ? 1 : names.hashCode() * 31;
    }

    @Override
    public String toString() {
        return isWildcard() ? WILDCARD_SYMBOL : String.join(", ", names);
    }
}
