package org.csu.spl.compiler.lexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hidyouth
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private static List<Token> tokenize(String source) {
        System.out.println("Input SPL: " + source); // [日志] 打印输入的SPL
        List<Token> tokens = new Lexer(source, LexerConfig.defaults(), DiagnosticListener.NONE).tokenize();
        System.out.println("Generated Tokens: " + tokens); // [日志] 打印生成的Token流
        return tokens;
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testRoleDefinition() {
        List<Token> tokens = tokenize("ROLE Admin {can: *}");

        assertEquals(List.of(TokenType.ROLE, TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.CAN,
                TokenType.COLON, TokenType.WILDCARD, TokenType.RBRACE, TokenType.EOF), types(tokens));
        assertEquals("Admin", tokens.get(1).value());
        assertEquals("CAN", tokens.get(3).value());
        assertEquals("*", tokens.get(5).lexeme());
        assertNull(tokens.get(5).value());
    }

    @Test
    void testPolicyWithCondition() {
        List<Token> tokens = tokenize(
                "ALLOW action: read, write ON resource: DB_Finance\nIF (time.hour > 9 AND time.hour < 17)");

        assertEquals(List.of(
                TokenType.ALLOW, TokenType.ACTION, TokenType.COLON, TokenType.IDENTIFIER, TokenType.COMMA,
                TokenType.IDENTIFIER, TokenType.ON, TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER,
                TokenType.IF, TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER,
                TokenType.GT, TokenType.NUMBER, TokenType.AND, TokenType.IDENTIFIER, TokenType.DOT,
                TokenType.IDENTIFIER, TokenType.LT, TokenType.NUMBER, TokenType.RPAREN, TokenType.EOF),
                types(tokens));
        assertEquals("resource", tokens.get(7).value());
        assertEquals(1, tokens.get(9).line());
        assertEquals(2, tokens.get(10).line());
        assertEquals(9L, tokens.get(16).number());
        assertEquals(17L, tokens.get(22).number());
    }

    @Test
    void testReservedWordsAreCaseSensitive() {
        List<Token> tokens = tokenize("ROLE role Role USER user ALLOW allow IF if ON on AND and OR or");

        assertEquals(List.of(TokenType.ROLE, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.USER, TokenType.IDENTIFIER, TokenType.ALLOW, TokenType.IDENTIFIER,
                TokenType.IF, TokenType.IDENTIFIER, TokenType.ON, TokenType.IDENTIFIER,
                TokenType.AND, TokenType.IDENTIFIER, TokenType.OR, TokenType.IDENTIFIER, TokenType.EOF),
                types(tokens));
    }

    @Test
    void testAttributeKeywordsAreCaseInsensitive() {
        List<Token> tokens = tokenize("CAN Can can cAN path PATH Path action ACTION Action");

        for (int i = 0; i < 4; i++) {
            assertEquals(TokenType.CAN, tokens.get(i).type());
            assertEquals("CAN", tokens.get(i).value());
        }
        for (int i = 4; i < 7; i++) {
            assertEquals(TokenType.PATH, tokens.get(i).type());
            assertEquals("PATH", tokens.get(i).value());
        }
        for (int i = 7; i < 10; i++) {
            assertEquals(TokenType.ACTION, tokens.get(i).type());
            assertEquals("ACTION", tokens.get(i).value());
        }
        assertEquals("Can", tokens.get(1).lexeme());
    }

    @Test
    void testKeywordPrefixesStayIdentifiers() {
        List<Token> tokens = tokenize("candy pathway actions ROLEX ONE IFFY");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
        assertEquals("candy", tokens.get(0).value());
        assertEquals("ROLEX", tokens.get(3).value());
    }

    @Test
    void testOperatorsPreferLongestMatch() {
        List<Token> tokens = tokenize("== != <= >= < > + - / ( ) { } : . ,");

        assertEquals(List.of(TokenType.EQ, TokenType.NE, TokenType.LE, TokenType.GE, TokenType.LT,
                TokenType.GT, TokenType.PLUS, TokenType.MINUS, TokenType.DIVIDE, TokenType.LPAREN,
                TokenType.RPAREN, TokenType.LBRACE, TokenType.RBRACE, TokenType.COLON, TokenType.DOT,
                TokenType.COMMA, TokenType.EOF), types(tokens));
        assertEquals("<=", tokens.get(2).lexeme());
    }

    @Test
    void testAdjacentComparisonWithoutSpaces() {
        List<Token> tokens = tokenize("a<=b>c");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LE, TokenType.IDENTIFIER, TokenType.GT,
                TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
    }

    @Test
    void testStringLiteralStripsQuotes() {
        List<Token> tokens = tokenize("\"/data/financial\"");

        assertEquals(2, tokens.size());
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("/data/financial", tokens.get(0).value());
        assertEquals("\"/data/financial\"", tokens.get(0).lexeme());
    }

    @Test
    void testEmptyStringLiteral() {
        List<Token> tokens = tokenize("path: \"\"");

        assertEquals(TokenType.STRING, tokens.get(2).type());
        assertEquals("", tokens.get(2).value());
    }

    @Test
    void testNumberLiterals() {
        List<Token> tokens = tokenize("9 17 0042");

        assertEquals(9L, tokens.get(0).number());
        assertEquals(17L, tokens.get(1).number());
        assertEquals(42L, tokens.get(2).number());
        assertEquals("0042", tokens.get(2).lexeme());
    }

    @Test
    void testMinusIsNotPartOfNumber() {
        List<Token> tokens = tokenize("-5");

        assertEquals(List.of(TokenType.MINUS, TokenType.NUMBER, TokenType.EOF), types(tokens));
        assertEquals(5L, tokens.get(1).number());
    }

    @Test
    void testIllegalCharacterIsReportedAndSkipped() {
        System.out.println("--- Running test: testIllegalCharacterIsReportedAndSkipped ---");
        TokenStream stream = new Lexer("ROLE Admin {can: #}", LexerConfig.defaults(), DiagnosticListener.NONE)
                .iterator();
        List<TokenType> types = new ArrayList<>();
        stream.forEachRemaining(token -> types.add(token.type()));

        assertEquals(List.of(TokenType.ROLE, TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.CAN,
                TokenType.COLON, TokenType.RBRACE), types);
        assertEquals(1, stream.diagnostics().size());
        LexicalDiagnostic diagnostic = stream.diagnostics().get(0);
        assertEquals(LexicalDiagnostic.Kind.ILLEGAL_CHARACTER, diagnostic.kind());
        assertEquals("#", diagnostic.text());
        assertEquals(1, diagnostic.line());
        assertEquals(17, diagnostic.position());
        assertEquals("Illegal character '#' at line 1, position 17", diagnostic.message());
    }

    @Test
    void testAllIllegalCharactersCollectedInOnePass() {
        TokenStream stream = new Lexer("a = b\n@ c $", LexerConfig.defaults(), DiagnosticListener.NONE).iterator();
        List<Token> tokens = new ArrayList<>();
        stream.forEachRemaining(tokens::add);

        assertEquals(List.of("a", "b", "c"), tokens.stream().map(Token::text).collect(Collectors.toList()));
        assertEquals(List.of("=", "@", "$"),
                stream.diagnostics().stream().map(LexicalDiagnostic::text).collect(Collectors.toList()));
        assertEquals(2, stream.diagnostics().get(1).line());
    }

    @Test
    void testUnterminatedStringReportsOpeningQuote() {
        TokenStream stream = new Lexer("RESOURCE R {path: \"/data}", LexerConfig.defaults(), DiagnosticListener.NONE)
                .iterator();
        List<TokenType> types = new ArrayList<>();
        stream.forEachRemaining(token -> types.add(token.type()));

        assertEquals(List.of(TokenType.RESOURCE, TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.PATH,
                TokenType.COLON, TokenType.DIVIDE, TokenType.IDENTIFIER, TokenType.RBRACE), types);
        assertEquals(1, stream.diagnostics().size());
        assertEquals("\"", stream.diagnostics().get(0).text());
        assertEquals(18, stream.diagnostics().get(0).position());
    }

    @Test
    void testStringDoesNotSpanLines() {
        TokenStream stream = new Lexer("\"abc\ndef\"", LexerConfig.defaults(), DiagnosticListener.NONE).iterator();
        List<Token> tokens = new ArrayList<>();
        stream.forEachRemaining(tokens::add);

        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("abc", tokens.get(0).value());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals(2, tokens.get(1).line());
        assertEquals(2, stream.diagnostics().size());
    }

    @Test
    void testNumberOutOfRange() {
        TokenStream stream = new Lexer("x 99999999999999999999 y", LexerConfig.defaults(), DiagnosticListener.NONE)
                .iterator();
        List<TokenType> types = new ArrayList<>();
        stream.forEachRemaining(token -> types.add(token.type()));

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER), types);
        assertEquals(LexicalDiagnostic.Kind.NUMBER_OUT_OF_RANGE, stream.diagnostics().get(0).kind());
        assertEquals(2, stream.diagnostics().get(0).position());
    }

    @Test
    void testDiagnosticListenerIsNotified() {
        DiagnosticListener listener = mock(DiagnosticListener.class);

        List<Token> tokens = new Lexer("ROLE Admin {can: #}", LexerConfig.defaults(), listener).tokenize();

        assertEquals(7, tokens.size());
        verify(listener, times(1)).report(LexicalDiagnostic.illegalCharacter('#', 1, 17));
        verifyNoMoreInteractions(listener);
    }

    @Test
    void testListenerNotCalledForCleanInput() {
        DiagnosticListener listener = mock(DiagnosticListener.class);

        new Lexer("USER JaneDoe {role: Developer}", LexerConfig.defaults(), listener).tokenize();

        verify(listener, never()).report(any());
    }

    @Test
    void testLineNumbersAcrossNewlineRuns() {
        List<Token> tokens = tokenize("ROLE A {can: read}\n\n\nUSER B {role: A}\r\nRESOURCE R {path: \"/r\"}");

        assertEquals(1, tokens.get(0).line());
        Token user = tokens.stream().filter(t -> t.type() == TokenType.USER).findFirst().orElseThrow();
        Token resource = tokens.stream().filter(t -> t.type() == TokenType.RESOURCE).findFirst().orElseThrow();
        assertEquals(4, user.line());
        assertEquals(5, resource.line());
        assertEquals(5, tokens.get(tokens.size() - 1).line());
    }

    @Test
    void testLineNumbersNeverDecrease() {
        String source = "ROLE Admin {can: *}\nUSER JaneDoe {role: Developer}\n"
                + "RESOURCE DB_Finance {path: \"/data/financial\"}\n"
                + "ALLOW action: read, write ON resource: DB_Finance\n"
                + "IF (time.hour * 2 > 9 AND time.hour < 17)\n\n"
                + "DENY action: * ON resource: DB_Finance # trailing\n";
        List<Token> tokens = tokenize(source);

        for (int i = 1; i < tokens.size(); i++) {
            assertTrue(tokens.get(i).line() >= tokens.get(i - 1).line(), "line decreased at token " + i);
        }
        assertEquals(8, tokens.get(tokens.size() - 1).line());
    }

    @Test
    void testEmptyAndBlankInput() {
        assertEquals(List.of(TokenType.EOF), types(tokenize("")));
        List<Token> blank = tokenize("  \t\n\n ");
        assertEquals(List.of(TokenType.EOF), types(blank));
        assertEquals(3, blank.get(0).line());
    }

    @Test
    void testEachIterationStartsFresh() {
        Lexer lexer = new Lexer("ROLE A {can: *}\n$ USER B {role: A}", LexerConfig.defaults(), DiagnosticListener.NONE);

        TokenStream first = lexer.iterator();
        List<Token> firstTokens = new ArrayList<>();
        first.forEachRemaining(firstTokens::add);
        TokenStream second = lexer.iterator();
        List<Token> secondTokens = new ArrayList<>();
        second.forEachRemaining(secondTokens::add);

        assertEquals(firstTokens, secondTokens);
        assertEquals(1, first.diagnostics().size());
        assertEquals(1, second.diagnostics().size());
        assertEquals(1, secondTokens.get(0).line());
    }

    @Test
    void testStreamIsLazyAndExcludesEof() {
        Lexer lexer = new Lexer("a b c d", LexerConfig.defaults(), DiagnosticListener.NONE);

        assertEquals(List.of("a", "b"), lexer.stream().limit(2).map(Token::text).collect(Collectors.toList()));
        assertEquals(4, lexer.stream().count());
    }

    @Test
    void testExhaustedStream() {
        TokenStream stream = new Lexer("a", LexerConfig.defaults(), DiagnosticListener.NONE).iterator();

        assertEquals(TokenType.IDENTIFIER, stream.next().type());
        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);
        assertEquals(TokenType.EOF, stream.nextToken().type());
        assertEquals(TokenType.EOF, stream.nextToken().type());
    }

    @Test
    void testConcurrentScansOfOneLexer() throws Exception {
        String source = "ROLE Admin {can: read, *}\nALLOW action: * ON resource: DB IF (a * 2 > 3)\n".repeat(50);
        Lexer lexer = new Lexer(source, LexerConfig.defaults(), DiagnosticListener.NONE);
        List<Token> expected = lexer.tokenize();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<Token>>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(lexer::tokenize));
            }
            for (Future<List<Token>> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testConfigFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(LexerConfig.SCAN_WINDOW_KEY, "12");
        properties.setProperty(LexerConfig.LOG_DIAGNOSTICS_KEY, "false");

        LexerConfig config = LexerConfig.fromProperties(properties);

        assertEquals(12, config.scanWindow());
        assertFalse(config.logDiagnostics());
        assertSame(DiagnosticListener.NONE, config.defaultListener());
    }

    @Test
    void testConfigRejectsInvalidWindow() {
        Properties properties = new Properties();
        properties.setProperty(LexerConfig.SCAN_WINDOW_KEY, "wide");
        assertThrows(IllegalArgumentException.class, () -> LexerConfig.fromProperties(properties));
        assertThrows(IllegalArgumentException.class, () -> new LexerConfig(0, true));
    }

    @Test
    void testConfigLoadsClasspathDefaults() {
        LexerConfig config = LexerConfig.load();

        assertEquals(LexerConfig.DEFAULT_SCAN_WINDOW, config.scanWindow());
        assertTrue(config.logDiagnostics());
        assertSame(LoggingDiagnosticListener.INSTANCE, config.defaultListener());
    }
}
