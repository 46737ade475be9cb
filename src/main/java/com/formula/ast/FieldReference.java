package com.formula.ast;

import java.util.Objects;

/**
 * Bare identifier referring to a field by its id.
 */
public record FieldReference(String fieldId) implements Expression {

    public FieldReference {
        Objects.requireNonNull(fieldId, "fieldId cannot be null");
        if (fieldId.isEmpty()) {
            throw new IllegalArgumentException("fieldId cannot be empty");
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFieldReference(this);
    }

    @Override
    public String toString() {
        return fieldId;
    }
}
