package org.csu.spl.compiler.lexer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 词法分析器配置。
 *
 * @param scanWindow     判定 '*' 时向前、向后各检查的字符数
 * @param logDiagnostics 未显式提供 {@link DiagnosticListener} 时，是否把诊断写入日志
 */
public record LexerConfig(int scanWindow, boolean logDiagnostics) {

    public static final String RESOURCE_NAME = "spl.properties";
    public static final String SCAN_WINDOW_KEY = "spl.lexer.scan-window";
    public static final String LOG_DIAGNOSTICS_KEY = "spl.lexer.log-diagnostics";

    public static final int DEFAULT_SCAN_WINDOW = 30;

    public LexerConfig {
        if (scanWindow <= 0) {
            throw new IllegalArgumentException("scanWindow must be positive, got " + scanWindow);
        }
    }

    public LexerConfig() {
        this(DEFAULT_SCAN_WINDOW, true);
    }

    public static LexerConfig defaults() {
        return new LexerConfig();
    }

    /**
     * 从 classpath 上的 {@value #RESOURCE_NAME} 读取配置，文件不存在时使用默认值。
     */
    public static LexerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = LexerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        return fromProperties(properties);
    }

    public static LexerConfig fromProperties(Properties properties) {
        String window = properties.getProperty(SCAN_WINDOW_KEY, String.valueOf(DEFAULT_SCAN_WINDOW)).trim();
        int scanWindow;
        try {
            scanWindow = Integer.parseInt(window);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + SCAN_WINDOW_KEY + ": '" + window + "'", e);
        }
        boolean logDiagnostics = Boolean.parseBoolean(
                properties.getProperty(LOG_DIAGNOSTICS_KEY, "true").trim());
        return new LexerConfig(scanWindow, logDiagnostics);
    }

    public DiagnosticListener defaultListener() {
        return logDiagnostics ? LoggingDiagnosticListener.INSTANCE : DiagnosticListener.NONE;
    }
}
