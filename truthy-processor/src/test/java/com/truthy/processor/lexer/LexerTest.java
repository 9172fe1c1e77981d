package com.truthy.processor.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 返回 token 类型序列（不含 EOF） */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .map(Token::getType)
                .filter(t -> t != TokenType.EOF)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("运算符与括号")
    class OperatorTests {

        @Test
        @DisplayName("逻辑运算符")
        void testOperators() {
            assertEquals(List.of(TokenType.AND, TokenType.OR, TokenType.NOT), types("&& || !"));
        }

        @Test
        @DisplayName("括号")
        void testParens() {
            assertEquals(List.of(TokenType.LPAREN, TokenType.RPAREN), types("()"));
        }

        @Test
        @DisplayName("运算符之间无需空白")
        void testNoWhitespace() {
            assertEquals(List.of(TokenType.NOT, TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.AND,
                    TokenType.IDENTIFIER, TokenType.RPAREN), types("!(a&&b)"));
        }
    }

    @Nested
    @DisplayName("标识符")
    class IdentifierTests {

        @Test
        @DisplayName("Java 标识符字符")
        void testIdentifierChars() {
            List<Token> tokens = scan("_x $y z9");
            assertEquals("_x", tokens.get(0).getLexeme());
            assertEquals("$y", tokens.get(1).getLexeme());
            assertEquals("z9", tokens.get(2).getLexeme());
            assertTrue(tokens.get(3).is(TokenType.EOF));
        }

        @Test
        @DisplayName("非 ASCII 的 Java 标识符")
        void testUnicodeIdentifiers() {
            List<Token> tokens = scan("名字 && é1");
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
            assertEquals("名字", tokens.get(0).getLexeme());
            assertEquals(TokenType.AND, tokens.get(1).getType());
            assertEquals(4, tokens.get(1).getColumn());
            assertEquals("é1", tokens.get(2).getLexeme());
            assertTrue(tokens.get(3).is(TokenType.EOF));
        }

        @Test
        @DisplayName("数字不能开头")
        void testDigitStart() {
            Token token = scan("1a").get(0);
            assertEquals(TokenType.ERROR, token.getType());
            assertEquals("Unexpected character: 1", token.getError());
        }

        @Test
        @DisplayName("行列号")
        void testPositions() {
            List<Token> tokens = scan("a &&\n  b");
            assertEquals(1, tokens.get(0).getColumn());
            assertEquals(3, tokens.get(1).getColumn());
            assertEquals(2, tokens.get(2).getLine());
            assertEquals(3, tokens.get(2).getColumn());
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("单个 & 提示 &&")
        void testSingleAmpersand() {
            Token token = scan("a & b").get(1);
            assertEquals(TokenType.ERROR, token.getType());
            assertEquals("Unexpected character '&'. Did you mean '&&'?", token.getError());
        }

        @Test
        @DisplayName("单个 | 提示 ||")
        void testSinglePipe() {
            Token token = scan("a | b").get(1);
            assertEquals(TokenType.ERROR, token.getType());
            assertTrue(token.getError().contains("'||'"));
        }

        @Test
        @DisplayName("表达式中不允许其它字符")
        void testUnexpectedCharacter() {
            Token token = scan("a == b").get(1);
            assertEquals(TokenType.ERROR, token.getType());
            assertEquals("Unexpected character: =", token.getError());
        }

        @Test
        @DisplayName("空输入只有 EOF")
        void testEmpty() {
            List<Token> tokens = scan("   ");
            assertEquals(1, tokens.size());
            assertEquals("end of expression", tokens.get(0).describe());
        }
    }
}
