package truthy;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result 类型：可能失败的计算结果
 *
 * <p>两种变体：Ok(value) 和 Err(error)。按真值规则，Err 恒为假，
 * Ok 的真假取决于其载荷（见 {@link TruthyTypes#result(Truthiness)}）。</p>
 *
 * @param <T> 成功值类型
 * @param <E> 错误值类型
 */
public final class Result<T, E> {

    private final boolean ok;
    private final Object value;  // Ok: success value, Err: error value

    private Result(boolean ok, Object value) {
        this.ok = ok;
        this.value = value;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(true, value);
    }

    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(false, error);
    }

    public boolean isOk() {
        return ok;
    }

    public boolean isErr() {
        return !ok;
    }

    /** Ok 时返回成功值，Err 时返回 null */
    @SuppressWarnings("unchecked")
    public T getValue() {
        return ok ? (T) value : null;
    }

    /** Err 时返回错误值，Ok 时返回 null */
    @SuppressWarnings("unchecked")
    public E getError() {
        return ok ? null : (E) value;
    }

    /** unwrap：Ok 返回成功值，Err 抛出异常 */
    public T unwrap() {
        if (!ok) throw new TruthyException("Called unwrap() on Err: " + value);
        return getValue();
    }

    /** unwrapOr：Ok 返回成功值，Err 返回 defaultValue */
    public T unwrapOr(T defaultValue) {
        return ok ? getValue() : defaultValue;
    }

    /** Ok 时映射成功值，Err 原样传递 */
    @SuppressWarnings("unchecked")
    public <U> Result<U, E> map(Function<? super T, ? extends U> f) {
        Objects.requireNonNull(f, "f");
        return ok ? Result.ok(f.apply(getValue())) : (Result<U, E>) this;
    }

    @Override
    public String toString() {
        return (ok ? "Ok(" : "Err(") + value + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result)) return false;
        Result<?, ?> other = (Result<?, ?>) o;
        return ok == other.ok && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(ok) + (value != null ? value.hashCode() : 0);
    }
}
