package com.truthy.processor.ast;

/**
 * 括号分组，改写时原样保留
 */
public class GroupExpr extends Expression {
    private final Expression inner;

    public GroupExpr(Position position, Expression inner) {
        super(position);
        this.inner = inner;
    }

    public Expression getInner() {
        return inner;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGroupExpr(this, context);
    }
}
