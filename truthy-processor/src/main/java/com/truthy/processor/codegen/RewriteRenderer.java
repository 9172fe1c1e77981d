package com.truthy.processor.codegen;

import com.truthy.processor.ast.AstVisitor;
import com.truthy.processor.ast.Expression;
import com.truthy.processor.ast.GroupExpr;
import com.truthy.processor.ast.Identifier;
import com.truthy.processor.ast.LogicalExpr;
import com.truthy.processor.ast.NotExpr;

/**
 * 把表达式渲染为改写后的文本形式
 *
 * <p>每个标识符 {@code x} 变为 {@code truthy(x)}，运算符与括号原样保留；
 * 嵌套的右侧表达式和取反的复合操作数补上括号，使文本分组与解析结构一致：
 * {@code a && b && c} 渲染为 {@code truthy(a) && (truthy(b) && truthy(c))}。</p>
 */
public final class RewriteRenderer implements AstVisitor<String, Void> {

    private final String callName;

    public RewriteRenderer(String callName) {
        this.callName = callName;
    }

    public RewriteRenderer() {
        this("truthy");
    }

    public String render(Expression expression) {
        return expression.accept(this, null);
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return callName + "(" + node.getName() + ")";
    }

    @Override
    public String visitNotExpr(NotExpr node, Void ctx) {
        return "!" + nested(node.getOperand());
    }

    @Override
    public String visitGroupExpr(GroupExpr node, Void ctx) {
        return "(" + render(node.getInner()) + ")";
    }

    @Override
    public String visitLogicalExpr(LogicalExpr node, Void ctx) {
        return render(node.getLeft()) + " " + node.getOperator().toSourceString() + " " + nested(node.getRight());
    }

    private String nested(Expression operand) {
        String text = render(operand);
        return operand instanceof LogicalExpr ? "(" + text + ")" : text;
    }
}
