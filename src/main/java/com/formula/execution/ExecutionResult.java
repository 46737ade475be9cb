package com.formula.execution;

/**
 * Outcome of executing a formula.
 *
 * @param success Whether execution completed
 * @param value   Result value on success (may be null)
 * @param error   Failure message, null on success
 */
public record ExecutionResult(boolean success, Object value, String error) {

    public static ExecutionResult success(Object value) {
        return new ExecutionResult(true, value, null);
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, null, error);
    }
}
