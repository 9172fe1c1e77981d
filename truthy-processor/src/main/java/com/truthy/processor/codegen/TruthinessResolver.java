package com.truthy.processor.codegen;

import com.palantir.javapoet.ClassName;
import com.palantir.javapoet.CodeBlock;
import com.palantir.javapoet.TypeName;
import com.truthy.processor.ast.Identifier;

import javax.lang.model.element.ElementKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 为参数类型选择真值判定
 *
 * <p>选择完全在编译期完成，生成的代码不做运行时类型检查。顺序：
 * <ol>
 *   <li>基本类型：原生比较</li>
 *   <li>{@code using} 注册表中的字段（类型完全相同）</li>
 *   <li>{@code Supplier<X>} / {@code BooleanSupplier}：到达时才取值</li>
 *   <li>内置表：包装类型、{@code String}、大数、{@code Optional*}、{@code Result}、{@code Either}</li>
 *   <li>{@code Void}、{@code Truthy} 实现类、记录、{@code CharSequence}、{@code Collection}、{@code Map}、数组</li>
 * </ol>
 * 其余类型报错。</p>
 */
public final class TruthinessResolver {

    private static final Logger LOG = Logger.getLogger(TruthinessResolver.class.getName());

    static final ClassName TRUTHINESS = ClassName.get("truthy", "Truthiness");
    static final ClassName TRUTHY_TYPES = ClassName.get("truthy", "TruthyTypes");
    static final ClassName TRUTHY_EITHER = ClassName.get("truthy.either", "TruthyEither");

    private static final Map<String, String> CONSTANTS = new HashMap<>();
    private static final Map<TypeKind, String> ARRAY_CONSTANTS = new HashMap<>();

    static {
        CONSTANTS.put("java.lang.Boolean", "BOOLEAN");
        CONSTANTS.put("java.lang.Byte", "BYTE");
        CONSTANTS.put("java.lang.Short", "SHORT");
        CONSTANTS.put("java.lang.Integer", "INTEGER");
        CONSTANTS.put("java.lang.Long", "LONG");
        CONSTANTS.put("java.lang.Float", "FLOAT");
        CONSTANTS.put("java.lang.Double", "DOUBLE");
        CONSTANTS.put("java.lang.Character", "CHARACTER");
        CONSTANTS.put("java.lang.String", "STRING");
        CONSTANTS.put("java.math.BigInteger", "BIG_INTEGER");
        CONSTANTS.put("java.math.BigDecimal", "BIG_DECIMAL");
        CONSTANTS.put("java.util.OptionalInt", "OPTIONAL_INT");
        CONSTANTS.put("java.util.OptionalLong", "OPTIONAL_LONG");
        CONSTANTS.put("java.util.OptionalDouble", "OPTIONAL_DOUBLE");
        CONSTANTS.put("truthy.Unit", "UNIT");

        ARRAY_CONSTANTS.put(TypeKind.INT, "INT_ARRAY");
        ARRAY_CONSTANTS.put(TypeKind.LONG, "LONG_ARRAY");
        ARRAY_CONSTANTS.put(TypeKind.DOUBLE, "DOUBLE_ARRAY");
        ARRAY_CONSTANTS.put(TypeKind.FLOAT, "FLOAT_ARRAY");
        ARRAY_CONSTANTS.put(TypeKind.BYTE, "BYTE_ARRAY");
        ARRAY_CONSTANTS.put(TypeKind.SHORT, "SHORT_ARRAY");
        ARRAY_CONSTANTS.put(TypeKind.CHAR, "CHAR_ARRAY");
        ARRAY_CONSTANTS.put(TypeKind.BOOLEAN, "BOOLEAN_ARRAY");
    }

    /** 注册表中的一个 {@code Truthiness<X>} 字段 */
    static final class Registration {
        final TypeMirror type;
        final CodeBlock reference;

        Registration(TypeMirror type, CodeBlock reference) {
            this.type = type;
            this.reference = reference;
        }
    }

    private final Elements elements;
    private final Types types;
    private final List<Registration> registrations = new ArrayList<>();

    public TruthinessResolver(Elements elements, Types types) {
        this.elements = elements;
        this.types = types;
    }

    /**
     * 注册 {@code owner.field} 作为 {@code type} 的真值判定
     */
    public void register(TypeMirror type, TypeElement owner, String field) {
        registrations.add(new Registration(type, CodeBlock.of("$T.$N", ClassName.get(owner), field)));
        LOG.fine("Registered truthiness " + owner.getQualifiedName() + "." + field + " for " + type);
    }

    /**
     * 参数 {@code param}（类型 {@code type}）在表达式中的叶子代码，结果是一个 boolean 的基本表达式
     *
     * @throws ResolutionException 该类型没有真值判定
     */
    public CodeBlock leaf(Identifier param, TypeMirror type) {
        String name = param.getName();
        switch (type.getKind()) {
            case BOOLEAN:
                return CodeBlock.of("$N", name);
            case BYTE:
            case SHORT:
            case INT:
            case LONG:
                return CodeBlock.of("($N != 0)", name);
            case FLOAT:
            case DOUBLE:
                return CodeBlock.of("($N != 0.0)", name);
            case CHAR:
                return CodeBlock.of("($N != '\\0')", name);
            case DECLARED:
            case ARRAY:
                break;
            default:
                throw unsupported(param, type, "no truthiness for this kind of type");
        }

        Registration registration = findRegistration(type);
        if (registration != null) {
            return CodeBlock.of("$L.isTruthy($N)", registration.reference, name);
        }
        if (isSubtypeOf(type, "java.util.function.BooleanSupplier")) {
            return CodeBlock.of("($N != null && $N.getAsBoolean())", name, name);
        }
        if (type.getKind() == TypeKind.DECLARED && isErasure(type, "java.util.function.Supplier")) {
            TypeMirror supplied = singleArgument(param, (DeclaredType) type);
            return CodeBlock.of("($N != null && $L.isTruthy($N.get()))", name, truthiness(param, supplied), name);
        }
        return CodeBlock.of("$L.isTruthy($N)", truthiness(param, type), name);
    }

    /**
     * 引用类型 {@code type} 的 {@code Truthiness} 表达式
     */
    CodeBlock truthiness(Identifier param, TypeMirror type) {
        Registration registration = findRegistration(type);
        if (registration != null) {
            return registration.reference;
        }
        if (type.getKind() == TypeKind.ARRAY) {
            TypeMirror component = ((ArrayType) type).getComponentType();
            String constant = ARRAY_CONSTANTS.get(component.getKind());
            if (constant != null) {
                return CodeBlock.of("$T.$N", TRUTHY_TYPES, constant);
            }
            checkArgument(param, type, component);
            return CodeBlock.of("$T.<$T>array()", TRUTHY_TYPES, TypeName.get(component));
        }
        if (type.getKind() != TypeKind.DECLARED) {
            throw unsupported(param, type, "no truthiness for this kind of type");
        }

        DeclaredType declared = (DeclaredType) type;
        String qualifiedName = ((TypeElement) declared.asElement()).getQualifiedName().toString();
        String constant = CONSTANTS.get(qualifiedName);
        if (constant != null) {
            return CodeBlock.of("$T.$N", TRUTHY_TYPES, constant);
        }

        switch (qualifiedName) {
            case "java.util.Optional": {
                TypeMirror value = singleArgument(param, declared);
                return CodeBlock.of("$T.<$T>optional($L)", TRUTHY_TYPES, TypeName.get(value),
                        truthiness(param, value));
            }
            case "truthy.Result": {
                List<? extends TypeMirror> args = arguments(param, declared, 2);
                return CodeBlock.of("$T.<$T, $T>result($L)", TRUTHY_TYPES,
                        TypeName.get(args.get(0)), TypeName.get(args.get(1)), truthiness(param, args.get(0)));
            }
            case "truthy.either.Either": {
                List<? extends TypeMirror> args = arguments(param, declared, 2);
                return CodeBlock.of("$T.<$T, $T>either($L, $L)", TRUTHY_EITHER,
                        TypeName.get(args.get(0)), TypeName.get(args.get(1)),
                        truthiness(param, args.get(0)), truthiness(param, args.get(1)));
            }
            default:
                break;
        }

        if (qualifiedName.equals("java.lang.Void")) {
            return CodeBlock.of("$T.never()", TRUTHY_TYPES);
        }
        if (isSubtypeOf(type, "truthy.Truthy")) {
            return CodeBlock.of("$T.natural()", TRUTHINESS);
        }
        // 记录与元组一样，有值即为真
        if (declared.asElement().getKind() == ElementKind.RECORD) {
            return CodeBlock.of("$T.always()", TRUTHY_TYPES);
        }
        if (isSubtypeOf(type, "java.lang.CharSequence")) {
            return CodeBlock.of("$T.text()", TRUTHY_TYPES);
        }
        if (isSubtypeOf(type, "java.util.Collection")) {
            return CodeBlock.of("$T.collection()", TRUTHY_TYPES);
        }
        if (isSubtypeOf(type, "java.util.Map")) {
            return CodeBlock.of("$T.map()", TRUTHY_TYPES);
        }
        throw unsupported(param, type,
                "no truthiness registered; implement truthy.Truthy or list a registry class in @TruthyPredicate(using = ...)");
    }

    private Registration findRegistration(TypeMirror type) {
        for (Registration registration : registrations) {
            if (types.isSameType(registration.type, type)) {
                return registration;
            }
        }
        return null;
    }

    private boolean isSubtypeOf(TypeMirror type, String qualifiedName) {
        TypeElement element = elements.getTypeElement(qualifiedName);
        return element != null && types.isAssignable(types.erasure(type), types.erasure(element.asType()));
    }

    private static boolean isErasure(TypeMirror type, String qualifiedName) {
        return ((TypeElement) ((DeclaredType) type).asElement()).getQualifiedName().contentEquals(qualifiedName);
    }

    private TypeMirror singleArgument(Identifier param, DeclaredType type) {
        return arguments(param, type, 1).get(0);
    }

    private List<? extends TypeMirror> arguments(Identifier param, DeclaredType type, int count) {
        List<? extends TypeMirror> args = type.getTypeArguments();
        if (args.size() != count) {
            throw unsupported(param, type, "raw type");
        }
        for (TypeMirror arg : args) {
            checkArgument(param, type, arg);
        }
        return args;
    }

    private static void checkArgument(Identifier param, TypeMirror owner, TypeMirror arg) {
        switch (arg.getKind()) {
            case WILDCARD:
                throw unsupported(param, owner, "wildcard type arguments are not supported");
            case TYPEVAR:
                throw unsupported(param, owner, "type variable arguments are not supported");
            default:
                break;
        }
    }

    private static ResolutionException unsupported(Identifier param, TypeMirror type, String reason) {
        return new ResolutionException("Cannot determine truthiness of parameter '" + param.getName()
                + "' of type " + type + ": " + reason, param);
    }
}
