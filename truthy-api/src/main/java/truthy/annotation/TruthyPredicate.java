package truthy.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个由真值表达式组成的接口
 *
 * <p>编译期由 truthy-processor 生成同包实现类 {@code Truthy_<Name>}，
 * 每个 {@link TruthyExpr} 方法体被改写为只含原生 {@code &&}、{@code ||}、{@code !}、
 * 括号及逐个参数真值判定的表达式。通过 {@code truthy.TruthyPredicates#create} 获取实例。</p>
 *
 * <pre>{@code
 * @TruthyPredicate
 * interface Access {
 *     @TruthyExpr("user && (roles || !locked)")
 *     boolean allowed(String user, List<String> roles, int locked);
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TruthyPredicate {

    /**
     * 额外的真值规则注册类。
     *
     * <p>这些类中 {@code public static final Truthiness<X>} 字段为类型 {@code X} 注册规则，
     * 优先于内置规则。</p>
     */
    Class<?>[] using() default {};
}
