package com.truthy.processor.parser;

import com.truthy.processor.lexer.Token;

/**
 * 解析异常：表达式不符合语法
 *
 * <p>消息形如 {@code Malformed boolean expression: ... at line 1, column 6 (found '&&'), expected: ...}。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    /**
     * @param token    第一个无法匹配的 token
     * @param expected 此处可接受的内容
     */
    public ParseException(String reason, Token token, String expected) {
        super(reason + " at line " + token.getLine() + ", column " + token.getColumn()
                + " (found " + token.describe() + "), expected: " + expected);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }
}
