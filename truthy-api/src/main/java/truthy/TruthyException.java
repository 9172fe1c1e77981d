package truthy;

/**
 * truthy 基础运行时异常。
 *
 * <p>真值判定与组合子本身永不抛出；此异常只用于 {@link Result#unwrap()} 之类的显式取值，
 * 以及找不到生成类等使用错误。</p>
 */
public class TruthyException extends RuntimeException {

    public TruthyException(String message) {
        super(message);
    }

    public TruthyException(String message, Throwable cause) {
        super(message, cause);
    }
}
