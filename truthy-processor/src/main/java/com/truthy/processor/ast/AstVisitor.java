package com.truthy.processor.ast;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitNotExpr(NotExpr node, C ctx) { return null; }

    default R visitGroupExpr(GroupExpr node, C ctx) { return null; }

    default R visitLogicalExpr(LogicalExpr node, C ctx) { return null; }
}
