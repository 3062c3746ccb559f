package org.csu.spl.compiler.lexer;

/**
 * @param type     词法单元的类型 (种别码)
 * @param lexeme   词法单元的原始文本 (词素)
 * @param value    字面值: 标识符/保留字文本, NUMBER 为 {@link Long}, STRING 为去掉引号的文本, 运算符与分隔符为 null
 * @param line     词素开始所在的行号 (从 1 开始)
 * @param position 词素在输入中的绝对偏移 (从 0 开始)
 */
public record Token(TokenType type, String lexeme, Object value, int line, int position) {

    public static Token eof(int line, int position) {
        return new Token(TokenType.EOF, "", null, line, position);
    }

    /**
     * 返回文本形式的值，NUMBER 转为十进制字符串，无值时返回 null。
     */
    public String text() {
        return value == null ? null : value.toString();
    }

    public long number() {
        if (!(value instanceof Long number)) {
            throw new IllegalStateException("Token " + type + " does not carry a number");
        }
        return number;
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-10s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, position);
    }
}
