package com.truthy.processor.lexer;

/**
 * 词法单元
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final String error;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, String error, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.error = error;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /** ERROR token 的错误描述，其余为 null */
    public String getError() {
        return error;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /**
     * 诊断信息中的 token 描述
     */
    public String describe() {
        return type == TokenType.EOF ? "end of expression" : "'" + lexeme + "'";
    }

    @Override
    public String toString() {
        return type + " " + describe() + " at " + line + ":" + column;
    }
}
