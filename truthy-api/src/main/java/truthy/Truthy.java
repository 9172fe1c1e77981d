package truthy;

/**
 * 可自行判定真值的类型
 *
 * <p>通常意味着值"非零、非空、存在"。实现者只需提供 {@link #isTruthy()}，
 * 它必须是纯函数：不读写共享状态，对任何实例都有定义，永不抛出异常。</p>
 *
 * <p>无法修改的类型（JDK 类型等）通过 {@link Truthiness} 注册真值规则。</p>
 */
public interface Truthy {

    /**
     * 值是否为真
     */
    boolean isTruthy();

    /**
     * 值是否为假，恒等于 {@code !isTruthy()}。
     *
     * <p>派生组合子依赖两者严格互补，实现者不应覆写此方法。</p>
     */
    default boolean isFalsy() {
        return !isTruthy();
    }
}
