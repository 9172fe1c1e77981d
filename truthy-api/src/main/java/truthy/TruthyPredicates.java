package truthy;

import truthy.annotation.TruthyPredicate;

import java.lang.reflect.InvocationTargetException;
import java.util.Objects;

/**
 * 获取 {@link TruthyPredicate} 接口的生成实现
 *
 * <p>生成类与接口同包，名为 {@code Truthy_} 加上接口的嵌套简单名（以 {@code _} 连接），
 * 如 {@code Outer.Access} 对应 {@code Truthy_Outer_Access}。</p>
 */
public final class TruthyPredicates {

    /** 生成类名前缀 */
    public static final String PREFIX = "Truthy_";

    private TruthyPredicates() {}

    /**
     * 生成类的全限定名
     */
    public static String generatedClassName(Class<?> type) {
        Objects.requireNonNull(type, "type");
        String name = type.getName();
        int dot = name.lastIndexOf('.');
        String pkg = dot >= 0 ? name.substring(0, dot + 1) : "";
        String nested = name.substring(dot + 1).replace('$', '_');
        return pkg + PREFIX + nested;
    }

    /**
     * 创建生成类实例
     *
     * @throws TruthyException 接口未标注、生成类缺失或无法实例化
     */
    public static <T> T create(Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (!type.isAnnotationPresent(TruthyPredicate.class)) {
            throw new TruthyException(type.getName() + " is not annotated with @TruthyPredicate");
        }
        String className = generatedClassName(type);
        try {
            Class<?> impl = Class.forName(className, true, type.getClassLoader());
            return type.cast(impl.getDeclaredConstructor().newInstance());
        } catch (ClassNotFoundException e) {
            throw new TruthyException("Generated class " + className
                    + " not found; is truthy-processor on the annotation processor path?", e);
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
            throw new TruthyException("Cannot instantiate " + className, e);
        } catch (InvocationTargetException e) {
            throw new TruthyException("Cannot instantiate " + className, e.getCause());
        }
    }
}
