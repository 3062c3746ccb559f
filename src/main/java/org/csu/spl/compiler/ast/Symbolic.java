package org.csu.spl.compiler.ast;

/**
 * 拥有源码符号的枚举 (运算符、策略类型)。导出和读回时都使用符号本身。
 */
public interface Symbolic {

    String symbol();

    static <E extends Enum<E> & Symbolic> E fromSymbol(Class<E> type, String symbol) {
        for (E constant : type.getEnumConstants()) {
            if (constant.symbol().equals(symbol)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " symbol '" + symbol + "'");
    }
}
