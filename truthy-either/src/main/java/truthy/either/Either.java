package truthy.either;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 二选一值：恰好持有 Left 或 Right 之一
 *
 * @param <L> Left 载荷类型
 * @param <R> Right 载荷类型
 */
public final class Either<L, R> {

    private final boolean left;
    private final Object value;

    private Either(boolean left, Object value) {
        this.left = left;
        this.value = value;
    }

    public static <L, R> Either<L, R> left(L value) {
        return new Either<>(true, value);
    }

    public static <L, R> Either<L, R> right(R value) {
        return new Either<>(false, value);
    }

    public boolean isLeft() {
        return left;
    }

    public boolean isRight() {
        return !left;
    }

    @SuppressWarnings("unchecked")
    public Optional<L> getLeft() {
        return left ? Optional.ofNullable((L) value) : Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public Optional<R> getRight() {
        return left ? Optional.empty() : Optional.ofNullable((R) value);
    }

    /**
     * 按当前变体选择映射
     */
    @SuppressWarnings("unchecked")
    public <U> U fold(Function<? super L, ? extends U> onLeft, Function<? super R, ? extends U> onRight) {
        Objects.requireNonNull(onLeft, "onLeft");
        Objects.requireNonNull(onRight, "onRight");
        return left ? onLeft.apply((L) value) : onRight.apply((R) value);
    }

    @Override
    public String toString() {
        return (left ? "Left(" : "Right(") + value + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Either)) return false;
        Either<?, ?> other = (Either<?, ?>) o;
        return left == other.left && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(left) + (value != null ? value.hashCode() : 0);
    }
}
