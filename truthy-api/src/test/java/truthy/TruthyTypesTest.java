package truthy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 标准真值规则测试
 */
class TruthyTypesTest {

    @Nested
    @DisplayName("数值：等于零为假")
    class NumericTests {

        @Test
        @DisplayName("整数")
        void testIntegers() {
            assertFalse(TruthyTypes.INTEGER.isTruthy(0));
            assertTrue(TruthyTypes.INTEGER.isTruthy(1));
            assertTrue(TruthyTypes.INTEGER.isTruthy(-1));
            assertFalse(TruthyTypes.LONG.isTruthy(0L));
            assertTrue(TruthyTypes.LONG.isTruthy(Long.MIN_VALUE));
            assertFalse(TruthyTypes.BYTE.isTruthy((byte) 0));
            assertTrue(TruthyTypes.SHORT.isTruthy((short) 7));
        }

        @Test
        @DisplayName("浮点：±0 为假，NaN 为真")
        void testFloatingPoint() {
            assertFalse(TruthyTypes.DOUBLE.isTruthy(0.0));
            assertFalse(TruthyTypes.DOUBLE.isTruthy(-0.0));
            assertTrue(TruthyTypes.DOUBLE.isTruthy(Double.NaN));
            assertTrue(TruthyTypes.DOUBLE.isTruthy(0.5));
            assertFalse(TruthyTypes.FLOAT.isTruthy(-0.0f));
            assertTrue(TruthyTypes.FLOAT.isTruthy(Float.NaN));
        }

        @Test
        @DisplayName("大数按符号判断，与标度无关")
        void testBigNumbers() {
            assertFalse(TruthyTypes.BIG_INTEGER.isTruthy(BigInteger.ZERO));
            assertTrue(TruthyTypes.BIG_INTEGER.isTruthy(BigInteger.TEN));
            assertFalse(TruthyTypes.BIG_DECIMAL.isTruthy(new BigDecimal("0.000")));
            assertTrue(TruthyTypes.BIG_DECIMAL.isTruthy(new BigDecimal("0.001")));
        }

        @Test
        @DisplayName("布尔与字符")
        void testBooleanAndCharacter() {
            assertTrue(TruthyTypes.BOOLEAN.isTruthy(true));
            assertFalse(TruthyTypes.BOOLEAN.isTruthy(false));
            assertFalse(TruthyTypes.CHARACTER.isTruthy('\0'));
            assertTrue(TruthyTypes.CHARACTER.isTruthy(' '));
        }
    }

    @Nested
    @DisplayName("序列：非空为真")
    class SequenceTests {

        @Test
        @DisplayName("字符串与字符序列")
        void testText() {
            assertFalse(TruthyTypes.STRING.isTruthy(""));
            assertTrue(TruthyTypes.STRING.isTruthy(" "));
            assertFalse(TruthyTypes.<StringBuilder>text().isTruthy(new StringBuilder()));
            assertTrue(TruthyTypes.<StringBuilder>text().isTruthy(new StringBuilder("x")));
        }

        @Test
        @DisplayName("集合与映射")
        void testCollections() {
            assertFalse(TruthyTypes.<List<String>>collection().isTruthy(new ArrayList<>()));
            assertTrue(TruthyTypes.<Set<Integer>>collection().isTruthy(Set.of(0)));
            assertFalse(TruthyTypes.<Map<String, String>>map().isTruthy(new HashMap<>()));
            assertTrue(TruthyTypes.<Map<String, String>>map().isTruthy(Map.of("k", "")));
        }

        @Test
        @DisplayName("数组只看长度，不看元素")
        void testArrays() {
            assertFalse(TruthyTypes.INT_ARRAY.isTruthy(new int[0]));
            assertTrue(TruthyTypes.INT_ARRAY.isTruthy(new int[]{0}));
            assertFalse(TruthyTypes.<String>array().isTruthy(new String[0]));
            assertTrue(TruthyTypes.<String>array().isTruthy(new String[]{""}));
            assertTrue(TruthyTypes.BOOLEAN_ARRAY.isTruthy(new boolean[]{false}));
        }
    }

    @Nested
    @DisplayName("容器")
    class ContainerTests {

        @Test
        @DisplayName("Optional：存在且内含值为真")
        void testOptional() {
            Truthiness<Optional<Integer>> opt = TruthyTypes.<Integer>optional(TruthyTypes.INTEGER);
            assertFalse(opt.isTruthy(Optional.empty()));
            assertFalse(opt.isTruthy(Optional.of(0)));
            assertTrue(opt.isTruthy(Optional.of(3)));
        }

        @Test
        @DisplayName("嵌套 Optional")
        void testNestedOptional() {
            Truthiness<Optional<Optional<String>>> nested = TruthyTypes.<Optional<String>>optional(TruthyTypes.<String>optional(TruthyTypes.STRING));
            assertFalse(nested.isTruthy(Optional.of(Optional.empty())));
            assertFalse(nested.isTruthy(Optional.of(Optional.of(""))));
            assertTrue(nested.isTruthy(Optional.of(Optional.of("x"))));
        }

        @Test
        @DisplayName("基本类型 Optional")
        void testPrimitiveOptionals() {
            assertFalse(TruthyTypes.OPTIONAL_INT.isTruthy(OptionalInt.empty()));
            assertFalse(TruthyTypes.OPTIONAL_INT.isTruthy(OptionalInt.of(0)));
            assertTrue(TruthyTypes.OPTIONAL_INT.isTruthy(OptionalInt.of(2)));
            assertFalse(TruthyTypes.OPTIONAL_DOUBLE.isTruthy(OptionalDouble.of(-0.0)));
        }

        @Test
        @DisplayName("Result：Err 恒为假，Ok 看成功值")
        void testResult() {
            Truthiness<Result<Integer, String>> result = TruthyTypes.<Integer, String>result(TruthyTypes.INTEGER);
            assertTrue(result.isTruthy(Result.ok(5)));
            assertFalse(result.isTruthy(Result.ok(0)));
            assertFalse(result.isTruthy(Result.err("nonempty")));
            assertFalse(result.isTruthy(Result.err("")));
        }
    }

    @Nested
    @DisplayName("常量规则")
    class ConstantTests {

        @Test
        @DisplayName("元组恒为真，Unit 恒为假")
        void testTupleAndUnit() {
            assertTrue(Truthiness.<Pair<Integer, Integer>>natural().isTruthy(Pair.of(0, 0)));
            assertFalse(TruthyTypes.UNIT.isTruthy(Unit.INSTANCE));
            assertTrue(TruthyTypes.always().isTruthy(new Object()));
            assertFalse(TruthyTypes.never().isTruthy("x"));
        }

        @Test
        @DisplayName("null 为假")
        void testNullIsFalsy() {
            assertFalse(TruthyTypes.STRING.isTruthy(null));
            assertFalse(TruthyTypes.always().isTruthy(null));
            assertTrue(TruthyTypes.INTEGER.isFalsy(null));
        }
    }
}
