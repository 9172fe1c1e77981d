package com.truthy.processor.codegen;

import com.truthy.processor.lexer.Lexer;
import com.truthy.processor.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 改写文本测试
 */
class RewriteRendererTest {

    private String render(String source) {
        return new RewriteRenderer().render(new Parser(new Lexer(source)).parse());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "a                | truthy(a)",
            "!a               | !truthy(a)",
            "a && b           | truthy(a) && truthy(b)",
            "a && b && c      | truthy(a) && (truthy(b) && truthy(c))",
            "x && (y || !z)   | truthy(x) && (truthy(y) || !truthy(z))",
            "(a || b) && c    | (truthy(a) || truthy(b)) && truthy(c)",
            "!a && b          | !(truthy(a) && truthy(b))",
            "!(a)             | !(truthy(a))",
            "!!a              | !!truthy(a)",
    })
    @DisplayName("每个标识符包裹为真值调用")
    void testRender(String source, String expected) {
        assertEquals(expected, render(source));
    }

    @Test
    @DisplayName("可配置调用名")
    void testCallName() {
        assertEquals("t(a) || t(b)", new RewriteRenderer("t").render(new Parser(new Lexer("a || b")).parse()));
    }
}
