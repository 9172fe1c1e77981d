package truthy.either;

import truthy.Truthiness;

import java.util.Objects;
import java.util.Optional;

/**
 * 与 {@link Either} 相关的真值规则和包装型组合子
 */
public final class TruthyEither {

    private TruthyEither() {}

    /**
     * 当前变体的载荷按对应规则为真
     */
    public static <L, R> Truthiness<Either<L, R>> either(Truthiness<? super L> leftTruthiness,
                                                         Truthiness<? super R> rightTruthiness) {
        Objects.requireNonNull(leftTruthiness, "leftTruthiness");
        Objects.requireNonNull(rightTruthiness, "rightTruthiness");
        return Truthiness.of(e -> e.<Boolean>fold(leftTruthiness::isTruthy, rightTruthiness::isTruthy));
    }

    /**
     * {@code value} 为真时返回 {@code Left(value)}，否则返回 {@code Right(other)}
     */
    public static <T, U> Either<T, U> truthyOr(Truthiness<? super T> truthiness, T value, U other) {
        Objects.requireNonNull(truthiness, "truthiness");
        return truthiness.isTruthy(value) ? Either.left(value) : Either.right(other);
    }

    /**
     * {@code value} 为真时返回包含 {@code other} 的 Optional，否则为空。
     *
     * <p>{@code other} 为 null 时同样为空。</p>
     */
    public static <T, U> Optional<U> truthyAnd(Truthiness<? super T> truthiness, T value, U other) {
        Objects.requireNonNull(truthiness, "truthiness");
        return truthiness.isTruthy(value) ? Optional.ofNullable(other) : Optional.empty();
    }
}
