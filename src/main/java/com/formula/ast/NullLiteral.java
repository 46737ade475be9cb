package com.formula.ast;

public record NullLiteral() implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNull(this);
    }

    @Override
    public String toString() {
        return "null";
    }
}
