package org.csu.spl.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * SPL 策略语言中所有可能出现的“单词”的分类，外部语法分析器依赖这套词汇表。
 */
public enum TokenType {
    // ---- 保留字 (Reserved words, 大小写敏感) ----
    ROLE,       // "ROLE"
    USER,       // "USER"
    RESOURCE,   // "RESOURCE"
    ALLOW,      // "ALLOW"
    DENY,       // "DENY"
    IF,         // "IF"
    ON,         // "ON"
    AND,        // "AND"
    OR,         // "OR"

    // ---- 属性关键字 (Attribute keywords, 大小写不敏感) ----
    CAN,        // can / CAN / Can
    PATH,       // path
    ACTION,     // action

    // ---- 比较运算符 (双字符) ----
    EQ,         // ==
    NE,         // !=
    LE,         // <=
    GE,         // >=

    // ---- 算术运算符 ----
    PLUS,       // +
    MINUS,      // -
    TIMES,      // * 乘法
    DIVIDE,     // /

    WILDCARD,   // * 通配符，与 TIMES 共用同一个字符，由上下文决定

    // ---- 比较运算符 (单字符) ----
    LT,         // <
    GT,         // >

    // ---- 字面量 ----
    IDENTIFIER, // 角色名、用户名、属性名等
    NUMBER,     // 非负整数, e.g., 17
    STRING,     // 双引号字符串, e.g., "/data/financial"

    // ---- 分隔符 (Delimiters) ----
    LBRACE,     // {
    RBRACE,     // }
    LPAREN,     // (
    RPAREN,     // )
    COLON,      // :
    DOT,        // .
    COMMA,      // ,

    // ---- 特殊 Token ----
    EOF;        // End-Of-File，表示输入流结束

    public boolean isReservedWord() {
        return ordinal() <= OR.ordinal();
    }

    public boolean isAttributeKeyword() {
        return this == CAN || this == PATH || this == ACTION;
    }
}
