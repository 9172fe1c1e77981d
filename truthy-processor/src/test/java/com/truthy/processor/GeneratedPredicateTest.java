package com.truthy.processor;

import com.truthy.processor.fixtures.Celsius;
import com.truthy.processor.fixtures.Chains;
import com.truthy.processor.fixtures.Rules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import truthy.Pair;
import truthy.Result;
import truthy.TruthyPredicates;
import truthy.Unit;
import truthy.either.Either;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 测试编译期间由处理器生成的实现
 */
class GeneratedPredicateTest {

    private final Rules rules = TruthyPredicates.create(Rules.class);
    private final Chains chains = TruthyPredicates.create(Chains.class);

    @Test
    @DisplayName("create 加载处理器生成的实现类")
    void testCreate() {
        assertEquals(TruthyPredicates.generatedClassName(Rules.class), rules.getClass().getName());
        assertEquals("com.truthy.processor.fixtures.Truthy_Chains_Inner",
                TruthyPredicates.create(Chains.Inner.class).getClass().getName());
        assertTrue(java.lang.reflect.Modifier.isFinal(chains.getClass().getModifiers()));
    }

    @Nested
    @DisplayName("运算符链")
    class ChainTests {

        @Test
        @DisplayName("分组按解析结构，向右嵌套")
        void testAllAssignments() {
            for (int mask = 0; mask < 8; mask++) {
                boolean a = (mask & 1) != 0;
                boolean b = (mask & 2) != 0;
                boolean c = (mask & 4) != 0;
                String label = "a=" + a + ", b=" + b + ", c=" + c;

                assertEquals(a && b && c, chains.allOf(a, b, c), label);
                assertEquals(a || (b && c), chains.orThenAnd(a, b, c), label);
                assertEquals(a && (b || c), chains.andThenOr(a, b, c), label);
                assertEquals((a && b) || c, chains.grouped(a, b, c), label);
                assertEquals(!(a && (b || c)), chains.negatedChain(a, b, c), label);
                assertEquals(!(a && !(b || c)), chains.negatedGroups(a, b, c), label);
            }
        }

        @Test
        @DisplayName("嵌套接口")
        void testNestedInterface() {
            Chains.Inner inner = TruthyPredicates.create(Chains.Inner.class);
            assertTrue(inner.blank(""));
            assertTrue(inner.blank(null));
            assertFalse(inner.blank(new StringBuilder("x")));
        }
    }

    @Nested
    @DisplayName("真值规则")
    class TruthinessTests {

        @Test
        @DisplayName("x=1, y=\"\", z=[] 为真")
        void testScenario() {
            assertTrue(rules.scenario(1, "", List.of()));
            assertFalse(rules.scenario(0, "y", List.of()));
            assertFalse(rules.scenario(2, "", List.of(3)));
        }

        @Test
        @DisplayName("Optional 与 Result")
        void testContainers() {
            assertTrue(rules.fallback(Optional.of("x"), Result.err("e")));
            assertFalse(rules.fallback(Optional.of(""), Result.ok(0)));
            assertTrue(rules.fallback(Optional.empty(), Result.ok(1)));
            assertFalse(rules.fallback(Optional.empty(), Result.err("nonempty error")));
        }

        @Test
        @DisplayName("Either 按当前变体")
        void testEither() {
            assertTrue(rules.emptyChoice(Either.left("")));
            assertTrue(rules.emptyChoice(Either.right(0)));
            assertFalse(rules.emptyChoice(Either.right(5)));
        }

        @Test
        @DisplayName("元组为真，Unit 为假")
        void testTupleAndUnit() {
            assertTrue(rules.tuple(Pair.of("", ""), Unit.INSTANCE));
            assertFalse(rules.tuple(null, Unit.INSTANCE));
        }

        @Test
        @DisplayName("注册表中的规则")
        void testRegistry() {
            assertTrue(rules.nonzero(new Celsius(-3.5)));
            assertFalse(rules.nonzero(new Celsius(0.0)));
        }

        @Test
        @DisplayName("BooleanSupplier 与可变参数")
        void testBooleanSupplierAndVarargs() {
            assertTrue(rules.ready(() -> true, "a"));
            assertFalse(rules.ready(() -> true));
            assertFalse(rules.ready(() -> false, "a"));
        }
    }

    @Nested
    @DisplayName("短路")
    class ShortCircuitTests {

        @Test
        @DisplayName("左侧为假时不调用 Supplier：除零不会发生")
        void testDivisionGuard() {
            int d = 0;
            assertFalse(rules.guarded(d, () -> 10 / d));
        }

        @Test
        @DisplayName("左侧为真时 Supplier 恰好调用一次")
        void testSupplierCalledOnce() {
            AtomicInteger calls = new AtomicInteger();
            Supplier<Integer> quotient = () -> {
                calls.incrementAndGet();
                return 10 / 5;
            };
            assertTrue(rules.guarded(5, quotient));
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("默认方法与生成方法组合")
        void testDefaultMethod() {
            assertTrue(rules.scenarioOrGuard(3, "", List.of(1)));
            assertFalse(rules.scenarioOrGuard(0, "", List.of()));
        }
    }
}
