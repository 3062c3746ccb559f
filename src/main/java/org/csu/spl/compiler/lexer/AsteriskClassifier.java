package org.csu.spl.compiler.lexer;

import java.util.List;
import java.util.Locale;

/**
 * @author hidyouth
 * @description: '*' 的上下文判定
 *
 * '*' 在 SPL 中既是权限通配符 ({@code can: *}, {@code action: *})，也是乘法运算符
 * ({@code 3 * 4}, {@code time.hour * 2})。这里只根据 '*' 前后有限窗口内的原始文本做判断，
 * 不依赖语法分析状态。规则按顺序求值，第一个命中的规则决定结果。
 * 字符串字面量附近的 '*' 等刻意构造的输入可能被误判，这是已知的局限。
 */
public final class AsteriskClassifier {

    private static final List<String> ATTRIBUTE_KEYWORDS = List.of("can", "action", "path");
    private static final List<String> TRAILING_WORDS = List.of("ON", "IF", "AND", "OR", "}", ",");

    public enum Rule {
        /** '*' 紧跟在 "can:" / "action:" / "path:" 之后 */
        ATTRIBUTE_COLON,
        /** 位于未闭合的 '{' 内且前面出现过 ':' */
        BRACE_ENCLOSURE,
        /** '*' 后面是 ON/IF/AND/OR/'}'/',' 或输入结束，且最近的 ':' 前是属性关键字 */
        TRAILING_KEYWORD,
        /** 两侧都是操作数 */
        ARITHMETIC_OPERANDS,
        /** 无法确定时按乘法处理 */
        DEFAULT
    }

    public record Resolution(TokenType type, Rule rule) {
        public boolean isWildcard() {
            return type == TokenType.WILDCARD;
        }
    }

    private AsteriskClassifier() {
    }

    /**
     * 对 input 中 position 处的 '*' 进行判定，前后各取 window 个字符作为上下文。
     */
    public static Resolution classify(CharSequence input, int position, int window) {
        if (position < 0 || position >= input.length() || input.charAt(position) != '*') {
            throw new IllegalArgumentException("No '*' at position " + position);
        }
        int beforeStart = Math.max(0, position - window);
        int afterEnd = Math.min(input.length(), position + 1 + window);
        String before = input.subSequence(beforeStart, position).toString();
        String after = input.subSequence(position + 1, afterEnd).toString();
        return classify(before, after);
    }

    /**
     * @param before '*' 之前的文本 (不含 '*')
     * @param after  '*' 之后的文本 (不含 '*')
     */
    public static Resolution classify(String before, String after) {
        if (followsAttributeColon(before)) {
            return new Resolution(TokenType.WILDCARD, Rule.ATTRIBUTE_COLON);
        }
        if (insideBraces(before)) {
            return new Resolution(TokenType.WILDCARD, Rule.BRACE_ENCLOSURE);
        }
        if (endsAttributeList(after) && colonFollowsAttributeKeyword(before)) {
            return new Resolution(TokenType.WILDCARD, Rule.TRAILING_KEYWORD);
        }
        if (isOperandEnd(lastNonBlank(before)) && isOperandStart(firstNonBlank(after))) {
            return new Resolution(TokenType.TIMES, Rule.ARITHMETIC_OPERANDS);
        }
        return new Resolution(TokenType.TIMES, Rule.DEFAULT);
    }

    private static boolean followsAttributeColon(String before) {
        int colon = before.lastIndexOf(':');
        return colon >= 0
                && before.substring(colon + 1).isBlank()
                && endsWithAttributeKeyword(before.substring(0, colon));
    }

    private static boolean insideBraces(String before) {
        int depth = 0;
        for (int i = 0; i < before.length(); i++) {
            char c = before.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth > 0 && before.indexOf(':') >= 0;
    }

    private static boolean endsAttributeList(String after) {
        String rest = after.strip();
        if (rest.isEmpty()) {
            return true;
        }
        for (String word : TRAILING_WORDS) {
            if (rest.startsWith(word)) {
                return true;
            }
        }
        return false;
    }

    private static boolean colonFollowsAttributeKeyword(String before) {
        int colon = before.lastIndexOf(':');
        return colon >= 0 && endsWithAttributeKeyword(before.substring(0, colon));
    }

    private static boolean endsWithAttributeKeyword(String text) {
        String trimmed = text.stripTrailing().toLowerCase(Locale.ROOT);
        for (String keyword : ATTRIBUTE_KEYWORDS) {
            if (trimmed.endsWith(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static char lastNonBlank(String text) {
        for (int i = text.length() - 1; i >= 0; i--) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return text.charAt(i);
            }
        }
        return '\0';
    }

    private static char firstNonBlank(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return text.charAt(i);
            }
        }
        return '\0';
    }

    private static boolean isOperandEnd(char c) {
        return isWordChar(c) || c == ')';
    }

    private static boolean isOperandStart(char c) {
        return isWordChar(c) || c == '(';
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
