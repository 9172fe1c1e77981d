package com.truthy.processor.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 真值表达式词法分析器
 *
 * <p>只识别标识符、{@code && || ! ( )} 与空白。其它字符产生 {@link TokenType#ERROR}，
 * 交由语法分析器报告。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final String sourceName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
    }

    public Lexer(String source) {
        this(source, "<expr>");
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，结尾处恒为 EOF
     */
    public Token nextToken() {
        skipWhitespace();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", null, line, current - lineStart + 1);
        }

        start = current;
        scanToken();
        return tokens.remove(tokens.size() - 1);
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> result = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            result.add(token);
        } while (!token.is(TokenType.EOF));
        return result;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                line++;
                lineStart = current;
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '!': addToken(TokenType.NOT); break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            default:
                if (Character.isJavaIdentifierStart(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private void identifier() {
        while (!isAtEnd() && Character.isJavaIdentifierPart(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, String error) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, error, line, start - lineStart + 1));
    }

    private void error(String message) {
        LOG.fine(String.format("[%s:%d:%d] Lexer error: %s",
                sourceName, line, start - lineStart + 1, message));
        addToken(TokenType.ERROR, message);
    }
}
