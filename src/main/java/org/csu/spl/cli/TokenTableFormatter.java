package org.csu.spl.cli;

import org.csu.spl.compiler.lexer.LexicalDiagnostic;
import org.csu.spl.compiler.lexer.Token;
import org.csu.spl.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个可重用的工具类，用于将 Token 列表格式化为带边框的控制台表格。
 */
public class TokenTableFormatter {

    private static final List<String> HEADER = List.of("Line", "Type", "Value");

    /**
     * 将 Token 列表和诊断信息格式化为字符串表格。
     *
     * @param tokens      Token 列表 (EOF 不显示)
     * @param diagnostics 扫描过程中收集到的诊断
     * @return 格式化后的表格字符串
     */
    public static String format(List<Token> tokens, List<LexicalDiagnostic> diagnostics) {
        List<List<String>> rows = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.EOF) {
                continue;
            }
            String value = token.value() == null ? token.lexeme() : token.text();
            rows.add(List.of(String.valueOf(token.line()), token.type().name(), value));
        }

        StringBuilder sb = new StringBuilder();
        if (rows.isEmpty()) {
            sb.append("No tokens.");
        } else {
            // 1. 计算每列的最大宽度
            List<Integer> columnWidths = new ArrayList<>();
            for (int i = 0; i < HEADER.size(); i++) {
                int maxWidth = HEADER.get(i).length();
                for (List<String> row : rows) {
                    maxWidth = Math.max(maxWidth, row.get(i).length());
                }
                columnWidths.add(maxWidth);
            }

            // 2. 表头、数据行和底部边框
            sb.append(getSeparator(columnWidths)).append("\n");
            sb.append(getRow(HEADER, columnWidths)).append("\n");
            sb.append(getSeparator(columnWidths)).append("\n");
            for (List<String> row : rows) {
                sb.append(getRow(row, columnWidths)).append("\n");
            }
            sb.append(getSeparator(columnWidths)).append("\n");
            sb.append(rows.size()).append(" tokens.");
        }

        // 3. 诊断信息附在表格之后
        for (LexicalDiagnostic diagnostic : diagnostics) {
            sb.append("\n").append(diagnostic.message());
        }
        return sb.toString();
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
