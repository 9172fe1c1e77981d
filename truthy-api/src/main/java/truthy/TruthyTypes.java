package truthy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * JDK 类型的标准真值规则
 *
 * <ul>
 *   <li>整数：不等于 0</li>
 *   <li>浮点：按 IEEE 比较不等于 0.0（±0 为假，NaN 为真）</li>
 *   <li>布尔：即其值</li>
 *   <li>文本、集合、映射、数组：长度大于 0</li>
 *   <li>Optional：存在且内含值为真</li>
 *   <li>Result：Ok 且载荷为真；Err 恒为假</li>
 *   <li>元组/记录：恒为真；无值类型：恒为假</li>
 * </ul>
 */
public final class TruthyTypes {

    private TruthyTypes() {}

    // ============ 标量 ============

    public static final Truthiness<Boolean> BOOLEAN = Truthiness.of(b -> b);

    public static final Truthiness<Byte> BYTE = Truthiness.of(n -> n != 0);

    public static final Truthiness<Short> SHORT = Truthiness.of(n -> n != 0);

    public static final Truthiness<Integer> INTEGER = Truthiness.of(n -> n != 0);

    public static final Truthiness<Long> LONG = Truthiness.of(n -> n != 0L);

    public static final Truthiness<BigInteger> BIG_INTEGER = Truthiness.of(n -> n.signum() != 0);

    /** 按数值比较，{@code 0.00} 同样为假 */
    public static final Truthiness<BigDecimal> BIG_DECIMAL = Truthiness.of(n -> n.signum() != 0);

    public static final Truthiness<Float> FLOAT = Truthiness.of(n -> n.floatValue() != 0.0f);

    public static final Truthiness<Double> DOUBLE = Truthiness.of(n -> n.doubleValue() != 0.0);

    public static final Truthiness<Character> CHARACTER = Truthiness.of(c -> c != '\0');

    // ============ 序列 ============

    public static final Truthiness<String> STRING = Truthiness.of(s -> !s.isEmpty());

    public static final Truthiness<int[]> INT_ARRAY = Truthiness.of(a -> a.length > 0);

    public static final Truthiness<long[]> LONG_ARRAY = Truthiness.of(a -> a.length > 0);

    public static final Truthiness<double[]> DOUBLE_ARRAY = Truthiness.of(a -> a.length > 0);

    public static final Truthiness<float[]> FLOAT_ARRAY = Truthiness.of(a -> a.length > 0);

    public static final Truthiness<byte[]> BYTE_ARRAY = Truthiness.of(a -> a.length > 0);

    public static final Truthiness<short[]> SHORT_ARRAY = Truthiness.of(a -> a.length > 0);

    public static final Truthiness<char[]> CHAR_ARRAY = Truthiness.of(a -> a.length > 0);

    public static final Truthiness<boolean[]> BOOLEAN_ARRAY = Truthiness.of(a -> a.length > 0);

    private static final Truthiness<CharSequence> TEXT = Truthiness.of(s -> s.length() > 0);
    private static final Truthiness<Collection<?>> COLLECTION = Truthiness.of(c -> !c.isEmpty());
    private static final Truthiness<Map<?, ?>> MAP = Truthiness.of(m -> !m.isEmpty());
    private static final Truthiness<Object[]> ARRAY = Truthiness.of(a -> a.length > 0);

    /**
     * 任意字符序列（String、StringBuilder 等）
     */
    @SuppressWarnings("unchecked")
    public static <S extends CharSequence> Truthiness<S> text() {
        return (Truthiness<S>) TEXT;
    }

    @SuppressWarnings("unchecked")
    public static <C extends Collection<?>> Truthiness<C> collection() {
        return (Truthiness<C>) COLLECTION;
    }

    @SuppressWarnings("unchecked")
    public static <M extends Map<?, ?>> Truthiness<M> map() {
        return (Truthiness<M>) MAP;
    }

    @SuppressWarnings("unchecked")
    public static <E> Truthiness<E[]> array() {
        return (Truthiness<E[]>) (Truthiness<?>) ARRAY;
    }

    // ============ 容器 ============

    public static final Truthiness<OptionalInt> OPTIONAL_INT =
            Truthiness.of(o -> o.isPresent() && o.getAsInt() != 0);

    public static final Truthiness<OptionalLong> OPTIONAL_LONG =
            Truthiness.of(o -> o.isPresent() && o.getAsLong() != 0L);

    public static final Truthiness<OptionalDouble> OPTIONAL_DOUBLE =
            Truthiness.of(o -> o.isPresent() && o.getAsDouble() != 0.0);

    /**
     * 存在且内含值按 {@code inner} 为真
     */
    public static <T> Truthiness<Optional<T>> optional(Truthiness<? super T> inner) {
        Objects.requireNonNull(inner, "inner");
        return Truthiness.of(o -> o.isPresent() && inner.isTruthy(o.get()));
    }

    /**
     * Ok 且成功值按 {@code inner} 为真；Err 不论错误值为何都为假
     */
    public static <T, E> Truthiness<Result<T, E>> result(Truthiness<? super T> inner) {
        Objects.requireNonNull(inner, "inner");
        return Truthiness.of(r -> r.isOk() && inner.isTruthy(r.getValue()));
    }

    // ============ 常量规则 ============

    private static final Truthiness<Object> ALWAYS = Truthiness.of(v -> true);
    private static final Truthiness<Object> NEVER = Truthiness.of(v -> false);

    /** 无值类型 */
    public static final Truthiness<Unit> UNIT = Truthiness.natural();

    /**
     * 恒为真（非 null 时），用于元组、记录等"有字段即有值"的类型
     */
    @SuppressWarnings("unchecked")
    public static <T> Truthiness<T> always() {
        return (Truthiness<T>) ALWAYS;
    }

    /**
     * 恒为假，用于无值类型
     */
    @SuppressWarnings("unchecked")
    public static <T> Truthiness<T> never() {
        return (Truthiness<T>) NEVER;
    }
}
