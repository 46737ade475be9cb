package com.formula.ast;

import java.util.Objects;

public record StringLiteral(String value) implements Expression {

    public StringLiteral {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
