package com.truthy.processor.ast;

/**
 * 短路逻辑表达式
 *
 * <p>左侧只会是 {@link Identifier} 或 {@link GroupExpr}；右侧是剩余的整个表达式。</p>
 */
public class LogicalExpr extends Expression {
    private final Expression left;
    private final LogicalOp operator;
    private final Expression right;

    public LogicalExpr(Position position, Expression left, LogicalOp operator, Expression right) {
        super(position);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public LogicalOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLogicalExpr(this, context);
    }

    /**
     * 逻辑运算符
     */
    public enum LogicalOp {
        AND("&&"),
        OR("||");

        private final String source;

        LogicalOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
