package truthy;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 惰性求值的布尔条件，即真值表达式的组合子形式
 *
 * <p>{@code x && (y || !z)} 写作
 * {@code and(t(x, ...), or(t(y, ...), not(t(z, ...))))}。
 * {@link #and} / {@link #or} 与原生 {@code &&} / {@code ||} 一样短路：
 * 结果已由左侧决定时右侧不会求值，惰性叶子的取值函数也不会被调用。</p>
 *
 * <p>兼容 Java 的 {@link BooleanSupplier}。</p>
 */
@FunctionalInterface
public interface Condition extends BooleanSupplier {

    /**
     * 求值
     */
    boolean test();

    @Override
    default boolean getAsBoolean() {
        return test();
    }

    // ============ 叶子 ============

    static Condition of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * 值按给定规则的真值
     */
    static <T> Condition t(T value, Truthiness<? super T> truthiness) {
        Objects.requireNonNull(truthiness, "truthiness");
        return () -> truthiness.isTruthy(value);
    }

    /**
     * 自行实现 {@link Truthy} 的值的真值；null 为假
     */
    static Condition t(Truthy value) {
        return () -> value != null && value.isTruthy();
    }

    /**
     * 到达该叶子时才调用 {@code value} 取值，每次求值调用一次
     */
    static <T> Condition lazy(Supplier<? extends T> value, Truthiness<? super T> truthiness) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(truthiness, "truthiness");
        return () -> truthiness.isTruthy(value.get());
    }

    // ============ 运算符 ============

    static Condition and(Condition left, Condition right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return () -> left.test() && right.test();
    }

    static Condition or(Condition left, Condition right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return () -> left.test() || right.test();
    }

    static Condition not(Condition operand) {
        Objects.requireNonNull(operand, "operand");
        return () -> !operand.test();
    }

    Condition TRUE = () -> true;

    Condition FALSE = () -> false;
}
