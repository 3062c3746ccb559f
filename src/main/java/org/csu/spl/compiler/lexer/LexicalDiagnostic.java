package org.csu.spl.compiler.lexer;

/**
 * 词法诊断信息。非法字符不会中断扫描，只会被记录下来并跳过。
 *
 * @param kind     诊断类别
 * @param text     出错的文本 (非法字符本身，或越界的数字)
 * @param line     所在行号
 * @param position 在输入中的绝对偏移
 */
public record LexicalDiagnostic(Kind kind, String text, int line, int position) {

    public enum Kind {
        ILLEGAL_CHARACTER,
        NUMBER_OUT_OF_RANGE
    }

    public static LexicalDiagnostic illegalCharacter(char ch, int line, int position) {
        return new LexicalDiagnostic(Kind.ILLEGAL_CHARACTER, String.valueOf(ch), line, position);
    }

    public String message() {
        return switch (kind) {
            case ILLEGAL_CHARACTER -> String.format("Illegal character '%s' at line %d, position %d",
                    text, line, position);
            case NUMBER_OUT_OF_RANGE -> String.format("Number literal '%s' out of range at line %d, position %d",
                    text, line, position);
        };
    }

    @Override
    public String toString() {
        return message();
    }
}
