package truthy;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 类型 {@code T} 的真值规则（类型类）
 *
 * <p>每个参与真值判定的类型注册一个实例，调用方在编译期选定，不做运行时类型分派。
 * 子类只实现 {@link #check(Object)}；{@code null} 一律视为"不存在"，即为假，
 * 因此 {@link #isTruthy(Object)} 对任何引用都有定义。</p>
 *
 * <p>派生组合子全部基于 {@link #isTruthy(Object)} / {@link #isFalsy(Object)}，
 * 不含任何类型相关逻辑。惰性版本（{@code orElse} / {@code andThen}）的回调最多调用一次，
 * 且只在需要其结果的分支上调用。</p>
 *
 * @param <T> 值类型
 */
public abstract class Truthiness<T> {

    protected Truthiness() {
    }

    /**
     * 判定非 null 值是否为真
     */
    protected abstract boolean check(T value);

    /**
     * 值是否为真。{@code null} 为假。
     */
    public final boolean isTruthy(T value) {
        return value != null && check(value);
    }

    /**
     * 值是否为假，恒等于 {@code !isTruthy(value)}
     */
    public final boolean isFalsy(T value) {
        return !isTruthy(value);
    }

    /**
     * 为真返回 {@code value}，否则返回 {@code fallback}。
     *
     * <pre>{@code
     * TruthyTypes.STRING.or("", "default")    // "default"
     * TruthyTypes.STRING.or("foo", "default") // "foo"
     * }</pre>
     */
    public final T or(T value, T fallback) {
        return isTruthy(value) ? value : fallback;
    }

    /**
     * 为真返回 {@code value}，否则调用 {@code fallback} 并返回其结果
     */
    public final T orElse(T value, Supplier<? extends T> fallback) {
        Objects.requireNonNull(fallback, "fallback");
        return isTruthy(value) ? value : fallback.get();
    }

    /**
     * 为假返回 {@code value}，否则返回 {@code replacement}。
     *
     * <p>对应短路 {@code &&}"左值为真时取右值"的语义，不是两个布尔值的与运算。</p>
     */
    public final T and(T value, T replacement) {
        return isFalsy(value) ? value : replacement;
    }

    /**
     * 为假返回 {@code value}，否则把 {@code value} 交给 {@code f} 并返回其结果。
     *
     * <pre>{@code
     * TruthyTypes.INTEGER.andThen(0, n -> n - 1) // 0，f 未被调用
     * TruthyTypes.INTEGER.andThen(2, n -> n - 1) // 1
     * }</pre>
     */
    public final T andThen(T value, Function<? super T, ? extends T> f) {
        Objects.requireNonNull(f, "f");
        return isFalsy(value) ? value : f.apply(value);
    }

    /**
     * 以当前规则创建一个可原地修改的变量
     */
    public final TruthyVar<T> var(T initial) {
        return new TruthyVar<>(initial, this);
    }

    /**
     * 由谓词创建规则。谓词只会收到非 null 值。
     */
    public static <T> Truthiness<T> of(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new Truthiness<T>() {
            @Override
            protected boolean check(T value) {
                return predicate.test(value);
            }
        };
    }

    /**
     * 自行实现 {@link Truthy} 的类型的规则
     */
    @SuppressWarnings("unchecked")
    public static <T extends Truthy> Truthiness<T> natural() {
        return (Truthiness<T>) NATURAL;
    }

    private static final Truthiness<Truthy> NATURAL = new Truthiness<Truthy>() {
        @Override
        protected boolean check(Truthy value) {
            return value.isTruthy();
        }
    };
}
