package com.formula.ast;

import java.util.Objects;

/**
 * Unary minus/plus or logical {@code not}.
 */
public record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {

    public UnaryOp {
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(operand, "operand cannot be null");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator == UnaryOperator.NOT
                ? "not " + operand
                : operator.symbol() + operand;
    }
}
