package com.truthy.processor.lexer;

/**
 * 真值表达式词法单元类型
 */
public enum TokenType {
    // === 标识符 ===
    IDENTIFIER,

    // === 操作符 - 逻辑 ===
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )

    // === 特殊 ===
    EOF,
    ERROR;

    /**
     * 是否为二元运算符
     */
    public boolean isBinaryOperator() {
        return this == AND || this == OR;
    }
}
