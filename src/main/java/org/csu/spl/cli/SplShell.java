package org.csu.spl.cli;

import org.csu.spl.compiler.lexer.DiagnosticListener;
import org.csu.spl.compiler.lexer.Lexer;
import org.csu.spl.compiler.lexer.LexerConfig;
import org.csu.spl.compiler.lexer.Token;
import org.csu.spl.compiler.lexer.TokenStream;
import org.csu.spl.compiler.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

/**
 * @author hidyouth
 * @description: SPL 交互式命令行
 *
 * 每输入一行 SPL 代码，打印对应的 Token 表；{@code source <file>} 对整个文件做词法分析；
 * {@code exit} / {@code quit} / {@code q} 退出。
 */
public class SplShell {

    private static final Logger logger = LoggerFactory.getLogger(SplShell.class);

    private final InputStream in;
    private final PrintStream out;
    private final LexerConfig config;

    public SplShell(InputStream in, PrintStream out, LexerConfig config) {
        this.in = in;
        this.out = out;
        this.config = config;
    }

    public static void main(String[] args) {
        LexerConfig config = LexerConfig.load();
        logger.info("Starting SPL shell, scan window {}", config.scanWindow());
        new SplShell(System.in, System.out, config).run();
    }

    public void run() {
        out.println("SPL Lexer. Type SPL code, 'source <file>' to tokenize a file, or 'exit' to quit.");
        try (Scanner consoleScanner = new Scanner(in, StandardCharsets.UTF_8)) {
            while (true) {
                out.print("SPL> ");
                if (!consoleScanner.hasNextLine()) {
                    break;
                }
                String line = consoleScanner.nextLine().trim();
                if (line.isEmpty()) {
                    continue;
                }
                if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit") || line.equalsIgnoreCase("q")) {
                    break;
                }
                // 手动导入
                if (line.toLowerCase().startsWith("source ")) {
                    executeFile(line.substring("source".length()).trim());
                    continue;
                }
                out.println(tokenize(line));
            }
        }
        out.println("Bye!");
    }

    private void executeFile(String filePath) {
        Path path = Path.of(filePath);
        if (!Files.isRegularFile(path)) {
            out.println("ERROR: File not found: " + path.toAbsolutePath());
            return;
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            logger.debug("Tokenizing {} ({} chars)", path, content.length());
            out.println(tokenize(content));
        } catch (IOException e) {
            logger.error("Failed to read {}", path, e);
            out.println("ERROR: Could not read file: " + e.getMessage());
        }
    }

    /**
     * 对一段文本做词法分析并格式化结果。
     */
    String tokenize(String source) {
        TokenStream stream = new Lexer(source, config, DiagnosticListener.NONE).iterator();
        List<Token> tokens = new ArrayList<>();
        Token token;
        while ((token = stream.nextToken()).type() != TokenType.EOF) {
            tokens.add(token);
        }
        return TokenTableFormatter.format(tokens, stream.diagnostics());
    }
}
