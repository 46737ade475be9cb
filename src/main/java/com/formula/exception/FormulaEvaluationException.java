package com.formula.exception;

/**
 * Exception thrown while executing a parsed formula against concrete values.
 */
public class FormulaEvaluationException extends FormulaException {

    public FormulaEvaluationException(String message) {
        super(message);
    }

    public FormulaEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
