package com.formula.function;

import java.util.Objects;

/**
 * Registry entry for a built-in function.
 *
 * @param name           Name used in formulas
 * @param minArity       Minimum number of arguments
 * @param maxArity       Maximum number of arguments, {@link #VARIADIC} for no limit
 * @param returnTypeRule Static return type
 * @param implementation Runtime implementation
 */
public record FunctionDefinition(
        String name,
        int minArity,
        int maxArity,
        ReturnTypeRule returnTypeRule,
        FormulaFunction implementation
) {
    public static final int VARIADIC = Integer.MAX_VALUE;

    public FunctionDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(returnTypeRule, "returnTypeRule cannot be null");
        Objects.requireNonNull(implementation, "implementation cannot be null");
        if (minArity < 0 || maxArity < minArity) {
            throw new IllegalArgumentException("Invalid arity range for function '" + name + "'");
        }
    }

    public boolean acceptsArity(int count) {
        return count >= minArity && count <= maxArity;
    }

    /**
     * Message for a call with the wrong number of arguments.
     */
    public String arityMismatch(int count) {
        String noun = minArity == 1 && maxArity == 1 ? "argument" : "arguments";
        return "Function '" + name + "' expects " + describeArity() + " " + noun + ", got " + count;
    }

    /**
     * Human-readable arity, e.g. "1", "1 to 2" or "at least 1".
     */
    public String describeArity() {
        if (minArity == maxArity) {
            return Integer.toString(minArity);
        }
        if (maxArity == VARIADIC) {
            return "at least " + minArity;
        }
        return minArity + " to " + maxArity;
    }
}
