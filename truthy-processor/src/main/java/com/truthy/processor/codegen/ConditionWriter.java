package com.truthy.processor.codegen;

import com.palantir.javapoet.CodeBlock;
import com.truthy.processor.ast.AstVisitor;
import com.truthy.processor.ast.Expression;
import com.truthy.processor.ast.GroupExpr;
import com.truthy.processor.ast.Identifier;
import com.truthy.processor.ast.LogicalExpr;
import com.truthy.processor.ast.NotExpr;

import java.util.Map;

/**
 * 把表达式写成 Java 布尔表达式代码
 *
 * <p>与 {@link RewriteRenderer} 结构相同，只是叶子换成各参数的真值判定代码，
 * 结果只含原生 {@code &&}、{@code ||}、{@code !} 与括号，保持原有的短路顺序。</p>
 */
final class ConditionWriter implements AstVisitor<CodeBlock, Void> {

    private final Map<String, CodeBlock> leaves;

    ConditionWriter(Map<String, CodeBlock> leaves) {
        this.leaves = leaves;
    }

    CodeBlock write(Expression expression) {
        return expression.accept(this, null);
    }

    @Override
    public CodeBlock visitIdentifier(Identifier node, Void ctx) {
        CodeBlock leaf = leaves.get(node.getName());
        if (leaf == null) {
            throw new ResolutionException("Unknown identifier '" + node.getName() + "'", node);
        }
        return leaf;
    }

    @Override
    public CodeBlock visitNotExpr(NotExpr node, Void ctx) {
        return CodeBlock.of("!$L", nested(node.getOperand()));
    }

    @Override
    public CodeBlock visitGroupExpr(GroupExpr node, Void ctx) {
        return CodeBlock.of("($L)", write(node.getInner()));
    }

    @Override
    public CodeBlock visitLogicalExpr(LogicalExpr node, Void ctx) {
        return CodeBlock.of("$L $L $L", write(node.getLeft()),
                node.getOperator().toSourceString(), nested(node.getRight()));
    }

    private CodeBlock nested(Expression operand) {
        CodeBlock code = write(operand);
        return operand instanceof LogicalExpr ? CodeBlock.of("($L)", code) : code;
    }
}
