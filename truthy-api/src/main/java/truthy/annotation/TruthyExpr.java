package truthy.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 方法的真值表达式
 *
 * <p>语法：{@code Expr := Term (BinOp Expr)? | '!' Expr | '(' Expr ')'}，
 * {@code Term} 为方法参数名，{@code BinOp} 为 {@code &&} 或 {@code ||}。
 * 没有优先级表：分组只由括号决定，未加括号的运算符链从左到右逐项消费、向右嵌套，
 * {@code !} 作用于其后的整个剩余表达式。</p>
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.METHOD)
public @interface TruthyExpr {

    String value();
}
