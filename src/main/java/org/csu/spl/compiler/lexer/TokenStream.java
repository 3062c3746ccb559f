package org.csu.spl.compiler.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * 一次扫描的状态：当前位置、行号和收集到的诊断。按需逐个产生 Token。
 *
 * <p>{@link #nextToken()} 面向语法分析器，输入耗尽后始终返回 EOF；
 * {@link #hasNext()}/{@link #next()} 是普通迭代器视图，不产出 EOF。
 */
public final class TokenStream implements Iterator<Token> {

    private static final Logger logger = LoggerFactory.getLogger(TokenStream.class);

    private final String input;
    private final int scanWindow;
    private final DiagnosticListener listener;
    private final List<LexicalDiagnostic> diagnostics = new ArrayList<>();

    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int emitted = 0;
    private boolean finished = false;
    private Token lookahead;

    TokenStream(String input, int scanWindow, DiagnosticListener listener) {
        this.input = input;
        this.scanWindow = scanWindow;
        this.listener = listener;
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null) {
            lookahead = scan();
        }
        return lookahead.type() != TokenType.EOF;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Token stream exhausted at line " + line);
        }
        return nextToken();
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token，输入结束后为 EOF
     */
    public Token nextToken() {
        if (lookahead != null) {
            Token token = lookahead;
            lookahead = null;
            return token;
        }
        return scan();
    }

    /**
     * 到目前为止收集到的诊断，按出现顺序排列。
     */
    public List<LexicalDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int line() {
        return line;
    }

    private Token scan() {
        while (true) {
            skipLayout();

            if (position >= input.length()) {
                if (!finished) {
                    finished = true;
                    logger.debug("Scanned {} tokens over {} lines, {} diagnostics",
                            emitted, line, diagnostics.size());
                }
                return Token.eof(line, position);
            }

            char currentChar = peek();

            // 识别标识符、保留字或属性关键字
            if (isLetter(currentChar)) {
                return emit(readWord());
            }

            // 识别数字
            if (isDigit(currentChar)) {
                Token number = readNumber();
                if (number != null) {
                    return emit(number);
                }
                continue;
            }

            // 识别字符串
            if (currentChar == '"') {
                Token string = readString();
                if (string != null) {
                    return emit(string);
                }
                continue;
            }

            // 识别运算符和分隔符，双字符运算符优先
            switch (currentChar) {
                case '=':
                    if (peekNext() == '=') {
                        return emit(consumeOperator(TokenType.EQ, "=="));
                    }
                    break;
                case '!':
                    if (peekNext() == '=') {
                        return emit(consumeOperator(TokenType.NE, "!="));
                    }
                    break;
                case '<':
                    if (peekNext() == '=') {
                        return emit(consumeOperator(TokenType.LE, "<="));
                    }
                    return emit(consumeOperator(TokenType.LT, "<"));
                case '>':
                    if (peekNext() == '=') {
                        return emit(consumeOperator(TokenType.GE, ">="));
                    }
                    return emit(consumeOperator(TokenType.GT, ">"));
                case '+':
                    return emit(consumeOperator(TokenType.PLUS, "+"));
                case '-':
                    return emit(consumeOperator(TokenType.MINUS, "-"));
                case '/':
                    return emit(consumeOperator(TokenType.DIVIDE, "/"));
                case '*':
                    return emit(readAsterisk());
                case '{':
                    return emit(consumeOperator(TokenType.LBRACE, "{"));
                case '}':
                    return emit(consumeOperator(TokenType.RBRACE, "}"));
                case '(':
                    return emit(consumeOperator(TokenType.LPAREN, "("));
                case ')':
                    return emit(consumeOperator(TokenType.RPAREN, ")"));
                case ':':
                    return emit(consumeOperator(TokenType.COLON, ":"));
                case '.':
                    return emit(consumeOperator(TokenType.DOT, "."));
                case ',':
                    return emit(consumeOperator(TokenType.COMMA, ","));
                default:
                    break;
            }

            // 非法字符：记录并跳过，继续扫描
            report(LexicalDiagnostic.illegalCharacter(currentChar, line, position));
            position++;
        }
    }

    private Token readWord() {
        int startPos = position;
        while (position < input.length() && isLetterOrDigit(peek())) {
            position++;
        }
        String text = input.substring(startPos, position);
        TokenType type = Lexer.classifyWord(text);
        // 属性关键字统一规范为大写
        String value = type.isAttributeKeyword() ? text.toUpperCase(Locale.ROOT) : text;
        return new Token(type, text, value, line, startPos);
    }

    private Token readNumber() {
        int startPos = position;
        while (position < input.length() && isDigit(peek())) {
            position++;
        }
        String digits = input.substring(startPos, position);
        try {
            return new Token(TokenType.NUMBER, digits, Long.parseLong(digits), line, startPos);
        } catch (NumberFormatException e) {
            report(new LexicalDiagnostic(LexicalDiagnostic.Kind.NUMBER_OUT_OF_RANGE, digits, line, startPos));
            return null;
        }
    }

    private Token readString() {
        int startPos = position;
        int end = startPos + 1;
        while (end < input.length() && input.charAt(end) != '"' && input.charAt(end) != '\n') {
            end++;
        }
        if (end >= input.length() || input.charAt(end) != '"') {
            // 未闭合的字符串：只把起始引号当作非法字符跳过
            report(LexicalDiagnostic.illegalCharacter('"', line, startPos));
            position++;
            return null;
        }
        position = end + 1;
        String text = input.substring(startPos + 1, end);
        return new Token(TokenType.STRING, input.substring(startPos, position), text, line, startPos);
    }

    private Token readAsterisk() {
        AsteriskClassifier.Resolution resolution = AsteriskClassifier.classify(input, position, scanWindow);
        if (logger.isTraceEnabled()) {
            logger.trace("'*' at line {}, position {} resolved as {} by rule {}",
                    line, position, resolution.type(), resolution.rule());
        }
        return consumeOperator(resolution.type(), "*");
    }

    // --- 辅助方法 ---

    private void skipLayout() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\f') {
                position++;
            } else if (ch == '\n') {
                line++;
                position++;
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private Token consumeOperator(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, null, line, position);
        position += lexeme.length();
        return token;
    }

    private Token emit(Token token) {
        emitted++;
        return token;
    }

    private void report(LexicalDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
        listener.report(diagnostic);
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
