package com.truthy.processor.ast;

/**
 * 标识符（叶子），改写为对应值的真值判定
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(Position position, String name) {
        super(position);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
