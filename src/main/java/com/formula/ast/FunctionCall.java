package com.formula.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Call of a named function. The name is not checked against the registry here;
 * the validator reports unknown names and the executor refuses to run them.
 */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return name + arguments.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
