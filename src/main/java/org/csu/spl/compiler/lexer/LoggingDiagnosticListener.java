package org.csu.spl.compiler.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 默认的诊断输出：以 WARN 级别写入日志。
 */
public final class LoggingDiagnosticListener implements DiagnosticListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticListener.class);

    public static final LoggingDiagnosticListener INSTANCE = new LoggingDiagnosticListener();

    private LoggingDiagnosticListener() {
    }

    @Override
    public void report(LexicalDiagnostic diagnostic) {
        logger.warn(diagnostic.message());
    }
}
