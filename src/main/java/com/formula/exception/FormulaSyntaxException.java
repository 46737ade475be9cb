package com.formula.exception;

/**
 * Exception thrown when formula text cannot be tokenized or parsed.
 * Never escapes the validator or executor; it is converted into a structured result there.
 */
public class FormulaSyntaxException extends FormulaException {

    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Character offset in the formula where the error was detected.
     */
    public int getPosition() {
        return position;
    }
}
