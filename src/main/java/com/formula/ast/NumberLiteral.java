package com.formula.ast;

import java.util.Objects;

/**
 * Numeric literal. Integral literals hold a {@link Long}, decimals a {@link Double}.
 */
public record NumberLiteral(Number value) implements Expression {

    public NumberLiteral {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
