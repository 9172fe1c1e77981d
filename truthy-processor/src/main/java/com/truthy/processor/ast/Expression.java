package com.truthy.processor.ast;

/**
 * 表达式节点基类
 */
public abstract class Expression {
    private final Position position;

    protected Expression(Position position) {
        this.position = position;
    }

    /** 节点起始 token 的位置 */
    public Position getPosition() {
        return position;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
