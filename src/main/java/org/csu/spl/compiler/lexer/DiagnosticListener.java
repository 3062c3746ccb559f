package org.csu.spl.compiler.lexer;

/**
 * 接收词法诊断的回调。每次扫描遇到非法输入时调用一次。
 */
@FunctionalInterface
public interface DiagnosticListener {

    DiagnosticListener NONE = diagnostic -> { };

    void report(LexicalDiagnostic diagnostic);
}
