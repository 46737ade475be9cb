package com.formula.function;

import com.formula.analysis.ResultType;

import java.util.List;

/**
 * Derives the static result type of a function call from its argument types.
 */
@FunctionalInterface
public interface ReturnTypeRule {

    /**
     * @param function      Function name, for warning messages
     * @param argumentTypes Inferred types of the arguments
     * @param warnings      Sink for non-blocking type warnings
     * @return Result type of the call
     */
    ResultType resolve(String function, List<ResultType> argumentTypes, List<String> warnings);

    static ReturnTypeRule fixed(ResultType type) {
        return (function, argumentTypes, warnings) -> type;
    }
}
