package truthy;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 可原地修改的真值变量
 *
 * <p>{@code xxxAssign} 系列只修改本变量，回调最多调用一次，且只在需要其结果时调用。
 * 与普通局部变量一样，同一实例的并发修改需由调用方串行化。</p>
 *
 * <pre>{@code
 * TruthyVar<Integer> count = TruthyTypes.INTEGER.var(0);
 * count.orAssign(2);                   // 2
 * count.andThenAssign(n -> n - 1);     // 1
 * }</pre>
 *
 * @param <T> 值类型
 */
public final class TruthyVar<T> {

    private final Truthiness<T> truthiness;
    private T value;

    public TruthyVar(T value, Truthiness<T> truthiness) {
        this.truthiness = Objects.requireNonNull(truthiness, "truthiness");
        this.value = value;
    }

    /**
     * 为自行实现 {@link Truthy} 的值创建变量
     */
    public static <T extends Truthy> TruthyVar<T> of(T value) {
        return new TruthyVar<>(value, Truthiness.<T>natural());
    }

    public T get() {
        return value;
    }

    public void set(T value) {
        this.value = value;
    }

    public Truthiness<T> getTruthiness() {
        return truthiness;
    }

    public boolean isTruthy() {
        return truthiness.isTruthy(value);
    }

    public boolean isFalsy() {
        return truthiness.isFalsy(value);
    }

    /**
     * 为假时设为 {@code fallback}，否则不变（{@code ||=}）
     */
    public TruthyVar<T> orAssign(T fallback) {
        if (isFalsy()) {
            value = fallback;
        }
        return this;
    }

    /**
     * 为假时设为 {@code fallback} 的结果，否则不变且不调用 {@code fallback}
     */
    public TruthyVar<T> orElseAssign(Supplier<? extends T> fallback) {
        Objects.requireNonNull(fallback, "fallback");
        if (isFalsy()) {
            value = fallback.get();
        }
        return this;
    }

    /**
     * 为真时设为 {@code replacement}，否则不变（{@code &&=}）
     */
    public TruthyVar<T> andAssign(T replacement) {
        if (isTruthy()) {
            value = replacement;
        }
        return this;
    }

    /**
     * 为真时把当前值交给 {@code f} 并设为其结果，否则不变且不调用 {@code f}
     */
    public TruthyVar<T> andThenAssign(Function<? super T, ? extends T> f) {
        Objects.requireNonNull(f, "f");
        if (isTruthy()) {
            value = f.apply(value);
        }
        return this;
    }

    @Override
    public String toString() {
        return "TruthyVar(" + value + ")";
    }
}
