package com.truthy.processor;

import com.palantir.javapoet.CodeBlock;
import com.palantir.javapoet.ParameterSpec;
import com.palantir.javapoet.TypeName;
import com.truthy.processor.ast.Expression;
import com.truthy.processor.ast.Identifier;
import com.truthy.processor.ast.IdentifierCollector;
import com.truthy.processor.codegen.PredicateGenerator;
import com.truthy.processor.codegen.ResolutionException;
import com.truthy.processor.codegen.RewriteRenderer;
import com.truthy.processor.codegen.TruthinessResolver;
import com.truthy.processor.lexer.Lexer;
import com.truthy.processor.parser.ParseException;
import com.truthy.processor.parser.Parser;
import truthy.annotation.TruthyExpr;
import truthy.annotation.TruthyPredicate;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.AnnotationValue;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.ExecutableType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@code @TruthyPredicate} 注解处理器
 *
 * <p>对每个注解接口：校验接口与方法，解析每个 {@code @TruthyExpr}，为每个参数选定真值判定，
 * 生成只含原生 {@code &&}、{@code ||}、{@code !} 的实现类。一个接口中的任何错误都会阻止该接口的生成，
 * 错误报告在出错的元素上。</p>
 */
public class TruthyProcessor extends AbstractProcessor {

    private static final Logger LOG = Logger.getLogger(TruthyProcessor.class.getName());

    private ProcessorConfig config;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.config = ProcessorConfig.fromOptions(processingEnv.getOptions());
    }

    @Override
    public Set<String> getSupportedAnnotationTypes() {
        return Set.of(TruthyPredicate.class.getCanonicalName());
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public Set<String> getSupportedOptions() {
        return ProcessorConfig.OPTIONS;
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        for (Element element : roundEnv.getElementsAnnotatedWith(TruthyPredicate.class)) {
            if (element.getKind() != ElementKind.INTERFACE) {
                error("@TruthyPredicate can only be applied to an interface", element);
                continue;
            }
            TypeElement type = (TypeElement) element;
            if (!type.getTypeParameters().isEmpty()) {
                error("@TruthyPredicate interface must not declare type parameters", type);
                continue;
            }
            if (!PredicateGenerator.isAccessibleFromPackage(type)) {
                error("@TruthyPredicate interface must not be private", type);
                continue;
            }
            processInterface(type);
        }
        return true;
    }

    private void processInterface(TypeElement type) {
        TruthinessResolver resolver = new TruthinessResolver(
                processingEnv.getElementUtils(), processingEnv.getTypeUtils());
        if (!readRegistry(type, resolver)) {
            return;
        }

        PredicateGenerator generator = new PredicateGenerator(
                type, TruthyProcessor.class.getName(), config.isGeneratedAnnotation());
        DeclaredType declaredType = (DeclaredType) type.asType();
        boolean failed = false;
        for (ExecutableElement method : ElementFilter.methodsIn(processingEnv.getElementUtils().getAllMembers(type))) {
            if (!method.getModifiers().contains(Modifier.ABSTRACT)) {
                continue;
            }
            ExecutableType methodType = (ExecutableType) processingEnv.getTypeUtils().asMemberOf(declaredType, method);
            failed |= !processMethod(type, method, methodType, resolver, generator);
        }
        if (failed) {
            return;
        }

        try {
            generator.build(processingEnv.getElementUtils()).writeTo(processingEnv.getFiler());
            LOG.fine("Generated " + PredicateGenerator.generatedSimpleName(type) + " for " + type.getQualifiedName());
        } catch (IOException e) {
            error("Failed to write implementation of " + type.getQualifiedName() + ": " + e.getMessage(), type);
        }
    }

    private boolean processMethod(TypeElement type, ExecutableElement method, ExecutableType methodType,
                                  TruthinessResolver resolver, PredicateGenerator generator) {
        TruthyExpr expr = method.getAnnotation(TruthyExpr.class);
        if (expr == null) {
            error("Abstract method " + method.getSimpleName() + " of a @TruthyPredicate interface needs @TruthyExpr",
                    method.getEnclosingElement().equals(type) ? method : type);
            return false;
        }
        if (methodType.getReturnType().getKind() != TypeKind.BOOLEAN) {
            error("@TruthyExpr method must return boolean", method);
            return false;
        }
        if (!method.getTypeParameters().isEmpty()) {
            error("@TruthyExpr method must not declare type parameters", method);
            return false;
        }

        String sourceName = type.getSimpleName() + "." + method.getSimpleName();
        Expression expression;
        try {
            expression = new Parser(new Lexer(expr.value(), sourceName)).parse();
        } catch (ParseException e) {
            error(e.getMessage(), method);
            return false;
        }

        List<? extends VariableElement> parameters = method.getParameters();
        List<? extends TypeMirror> parameterTypes = methodType.getParameterTypes();
        Map<String, TypeMirror> byName = new LinkedHashMap<>();
        List<ParameterSpec> specs = new ArrayList<>();
        for (int i = 0; i < parameters.size(); i++) {
            String name = parameters.get(i).getSimpleName().toString();
            byName.put(name, parameterTypes.get(i));
            specs.add(ParameterSpec.builder(TypeName.get(parameterTypes.get(i)), name).build());
        }

        Map<String, CodeBlock> leaves = new LinkedHashMap<>();
        try {
            for (Identifier identifier : IdentifierCollector.collect(expression).values()) {
                TypeMirror parameterType = byName.get(identifier.getName());
                if (parameterType == null) {
                    throw new ResolutionException("Unknown identifier '" + identifier.getName()
                            + "' in @TruthyExpr; parameters are " + byName.keySet(), identifier);
                }
                leaves.put(identifier.getName(), resolver.leaf(identifier, parameterType));
            }
        } catch (ResolutionException e) {
            error(e.getMessage(), method);
            return false;
        }

        String rewrite = new RewriteRenderer(config.getCallName()).render(expression);
        if (config.isVerbose()) {
            processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                    sourceName + ": " + expr.value() + " => " + rewrite, method);
        }
        generator.addMethod(method.getSimpleName().toString(), specs, method.isVarArgs(),
                expr.value(), rewrite, expression, leaves);
        return true;
    }

    /**
     * 读取 {@code using} 中各类的 {@code public static final Truthiness<X>} 字段
     *
     * <p>通过 {@link AnnotationMirror} 读取，避免访问尚未编译的 {@code Class} 对象。</p>
     */
    private boolean readRegistry(TypeElement type, TruthinessResolver resolver) {
        TypeElement truthiness = processingEnv.getElementUtils().getTypeElement("truthy.Truthiness");
        for (AnnotationMirror mirror : type.getAnnotationMirrors()) {
            TypeElement annotationType = (TypeElement) mirror.getAnnotationType().asElement();
            if (!annotationType.getQualifiedName().contentEquals(TruthyPredicate.class.getCanonicalName())) {
                continue;
            }
            for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> entry
                    : mirror.getElementValues().entrySet()) {
                if (!entry.getKey().getSimpleName().contentEquals("using")) {
                    continue;
                }
                @SuppressWarnings("unchecked")
                List<? extends AnnotationValue> values = (List<? extends AnnotationValue>) entry.getValue().getValue();
                for (AnnotationValue value : values) {
                    TypeElement registry = (TypeElement) ((DeclaredType) value.getValue()).asElement();
                    if (!registerFields(registry, truthiness, resolver)) {
                        error(registry.getQualifiedName() + " declares no public static final Truthiness fields",
                                type, mirror, value);
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private boolean registerFields(TypeElement registry, TypeElement truthiness, TruthinessResolver resolver) {
        boolean found = false;
        for (VariableElement field : ElementFilter.fieldsIn(registry.getEnclosedElements())) {
            Set<Modifier> modifiers = field.getModifiers();
            if (!modifiers.containsAll(Set.of(Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL))
                    || field.asType().getKind() != TypeKind.DECLARED) {
                continue;
            }
            DeclaredType fieldType = (DeclaredType) field.asType();
            if (!fieldType.asElement().equals(truthiness) || fieldType.getTypeArguments().size() != 1) {
                continue;
            }
            resolver.register(fieldType.getTypeArguments().get(0), registry, field.getSimpleName().toString());
            found = true;
        }
        return found;
    }

    private void error(String message, Element element) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element);
    }

    private void error(String message, Element element, AnnotationMirror mirror, AnnotationValue value) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element, mirror, value);
    }
}
