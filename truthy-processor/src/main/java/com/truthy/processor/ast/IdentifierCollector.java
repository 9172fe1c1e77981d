package com.truthy.processor.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按首次出现顺序收集表达式中的标识符
 */
public final class IdentifierCollector implements AstVisitor<Void, Map<String, Identifier>> {

    private static final IdentifierCollector INSTANCE = new IdentifierCollector();

    private IdentifierCollector() {}

    /**
     * @return 名称 → 首次出现的节点
     */
    public static Map<String, Identifier> collect(Expression expression) {
        Map<String, Identifier> result = new LinkedHashMap<>();
        expression.accept(INSTANCE, result);
        return result;
    }

    @Override
    public Void visitIdentifier(Identifier node, Map<String, Identifier> ctx) {
        ctx.putIfAbsent(node.getName(), node);
        return null;
    }

    @Override
    public Void visitNotExpr(NotExpr node, Map<String, Identifier> ctx) {
        return node.getOperand().accept(this, ctx);
    }

    @Override
    public Void visitGroupExpr(GroupExpr node, Map<String, Identifier> ctx) {
        return node.getInner().accept(this, ctx);
    }

    @Override
    public Void visitLogicalExpr(LogicalExpr node, Map<String, Identifier> ctx) {
        node.getLeft().accept(this, ctx);
        return node.getRight().accept(this, ctx);
    }
}
