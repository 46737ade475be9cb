package com.formula.function;

import com.formula.exception.FormulaEvaluationException;

import java.util.List;

/**
 * Callable invoked by a formula. Built-ins live in {@link FunctionRegistry};
 * callers may pass extra functions to the executor by name.
 */
@FunctionalInterface
public interface FormulaFunction {

    /**
     * Invoke the function.
     *
     * @param arguments Evaluated argument values (may contain nulls)
     * @return Result value
     * @throws FormulaEvaluationException if the arguments cannot be processed
     */
    Object apply(List<Object> arguments);
}
