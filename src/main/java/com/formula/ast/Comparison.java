package com.formula.ast;

import java.util.Objects;

public record Comparison(ComparisonOperator operator, Expression left, Expression right) implements Expression {

    public Comparison {
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
