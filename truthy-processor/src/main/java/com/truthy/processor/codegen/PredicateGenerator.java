package com.truthy.processor.codegen;

import com.palantir.javapoet.AnnotationSpec;
import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.CodeBlock;
import com.palantir.javapoet.JavaFile;
import com.palantir.javapoet.MethodSpec;
import com.palantir.javapoet.ParameterSpec;
import com.palantir.javapoet.TypeName;
import com.palantir.javapoet.TypeSpec;
import com.truthy.processor.ast.Expression;
import truthy.TruthyPredicates;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 生成 {@code @TruthyPredicate} 接口的实现类 {@code Truthy_<Name>}
 */
public final class PredicateGenerator {

    private static final ClassName GENERATED = ClassName.get("javax.annotation.processing", "Generated");

    private final TypeElement type;
    private final String generator;
    private final boolean generatedAnnotation;
    private final List<MethodSpec> methods = new ArrayList<>();
    private final Set<String> parameterNames = new LinkedHashSet<>();

    /**
     * @param generator           {@code @Generated} 中记录的生成器名
     * @param generatedAnnotation 是否添加 {@code @Generated}
     */
    public PredicateGenerator(TypeElement type, String generator, boolean generatedAnnotation) {
        this.type = type;
        this.generator = generator;
        this.generatedAnnotation = generatedAnnotation;
    }

    /**
     * 生成类的简单名：嵌套类型名用 {@code _} 连接
     */
    public static String generatedSimpleName(TypeElement type) {
        Deque<String> names = new ArrayDeque<>();
        Element current = type;
        while (current != null && (current.getKind().isClass() || current.getKind().isInterface())) {
            names.addFirst(current.getSimpleName().toString());
            current = current.getEnclosingElement();
        }
        return TruthyPredicates.PREFIX + String.join("_", names);
    }

    /**
     * 添加一个实现方法
     *
     * @param name       方法名
     * @param parameters 参数，按声明顺序
     * @param varargs    最后一个参数是否为可变参数
     * @param source     原表达式文本
     * @param rewrite    改写后的文本形式
     * @param expression 解析后的表达式
     * @param leaves     参数名 → 叶子代码
     */
    public void addMethod(String name, List<ParameterSpec> parameters, boolean varargs,
                          String source, String rewrite, Expression expression, Map<String, CodeBlock> leaves) {
        CodeBlock condition = new ConditionWriter(leaves).write(expression);
        for (ParameterSpec parameter : parameters) {
            parameterNames.add(parameter.name());
        }
        methods.add(MethodSpec.methodBuilder(name)
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PUBLIC)
                .returns(TypeName.BOOLEAN)
                .addParameters(parameters)
                .varargs(varargs)
                .addJavadoc("{@code $L}\n<p>\n{@code $L}\n", source, rewrite)
                .addStatement("return $L", condition)
                .build());
    }

    public JavaFile build(Elements elements) {
        TypeSpec.Builder builder = TypeSpec.classBuilder(generatedSimpleName(type))
                .addOriginatingElement(type)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addSuperinterface(TypeName.get(type.asType()))
                .addJavadoc("Generated implementation of {@link $T}.\n", ClassName.get(type))
                .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC).build())
                .addMethods(methods)
                // 参数名会遮蔽同名的类型，如 String TruthyTypes
                .alwaysQualify(parameterNames.toArray(new String[0]));
        if (generatedAnnotation && elements.getTypeElement(GENERATED.canonicalName()) != null) {
            builder.addAnnotation(AnnotationSpec.builder(GENERATED)
                    .addMember("value", "$S", generator)
                    .build());
        }
        String packageName = elements.getPackageOf(type).getQualifiedName().toString();
        return JavaFile.builder(packageName, builder.build())
                .skipJavaLangImports(true)
                .build();
    }

    /**
     * 嵌套在私有类型中的接口无法在包内实现
     */
    public static boolean isAccessibleFromPackage(TypeElement type) {
        Element current = type;
        while (current != null && current.getKind() != ElementKind.PACKAGE) {
            if (current.getModifiers().contains(Modifier.PRIVATE)) {
                return false;
            }
            current = current.getEnclosingElement();
        }
        return true;
    }
}
