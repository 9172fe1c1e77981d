package com.truthy.processor.ast;

/**
 * 取反：作用于 {@code !} 之后的整个剩余表达式
 */
public class NotExpr extends Expression {
    private final Expression operand;

    public NotExpr(Position position, Expression operand) {
        super(position);
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNotExpr(this, context);
    }
}
