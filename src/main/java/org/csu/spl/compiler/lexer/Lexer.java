package org.csu.spl.compiler.lexer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的 SPL 文本分解为一系列的 Token。
 * Lexer 本身只保存不可变的输入和配置；每次调用 {@link #iterator()} 都会得到一个全新的
 * {@link TokenStream}，行号、扫描位置和诊断列表都属于那一次扫描，因此同一个 Lexer
 * 可以被重复扫描，也可以在多个线程中同时扫描。
 */
public class Lexer implements Iterable<Token> {

    // 保留字映射表，大小写敏感
    private static final Map<String, TokenType> reservedWords;
    // 属性关键字映射表，查找前统一转为小写
    private static final Map<String, TokenType> attributeKeywords;

    static {
        reservedWords = new HashMap<>();
        reservedWords.put("ROLE", TokenType.ROLE);
        reservedWords.put("USER", TokenType.USER);
        reservedWords.put("RESOURCE", TokenType.RESOURCE);
        reservedWords.put("ALLOW", TokenType.ALLOW);
        reservedWords.put("DENY", TokenType.DENY);
        reservedWords.put("IF", TokenType.IF);
        reservedWords.put("ON", TokenType.ON);
        reservedWords.put("AND", TokenType.AND);
        reservedWords.put("OR", TokenType.OR);

        attributeKeywords = new HashMap<>();
        attributeKeywords.put("can", TokenType.CAN);
        attributeKeywords.put("path", TokenType.PATH);
        attributeKeywords.put("action", TokenType.ACTION);
    }

    private final String input;
    private final LexerConfig config;
    private final DiagnosticListener listener;

    public Lexer(String input) {
        this(input, LexerConfig.defaults());
    }

    public Lexer(String input, LexerConfig config) {
        this(input, config, config.defaultListener());
    }

    public Lexer(String input, LexerConfig config, DiagnosticListener listener) {
        this.input = Objects.requireNonNull(input, "input");
        this.config = Objects.requireNonNull(config, "config");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * 开始一次新的扫描。返回的迭代器不会产出 EOF。
     */
    @Override
    public TokenStream iterator() {
        return new TokenStream(input, config.scanWindow(), listener);
    }

    public Stream<Token> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * 主方法，执行完整的词法分析并返回所有Token
     * @return Token列表，最后一个元素总是 EOF
     */
    public List<Token> tokenize() {
        TokenStream stream = iterator();
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = stream.nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    public String input() {
        return input;
    }

    public LexerConfig config() {
        return config;
    }

    /**
     * 对一个已完整匹配的标识符进行分类：先查保留字，再查属性关键字，否则为普通标识符。
     */
    static TokenType classifyWord(String text) {
        TokenType reserved = reservedWords.get(text);
        if (reserved != null) {
            return reserved;
        }
        return attributeKeywords.getOrDefault(text.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
    }
}
