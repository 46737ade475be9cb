package com.formula.effect;

/**
 * Outcome of evaluating a single rule's condition.
 *
 * @param success Whether the condition could be evaluated
 * @param fired   Condition value; false for disabled rules and failures
 * @param error   Rule-tagged failure message, null on success
 */
public record RuleOutcome(boolean success, boolean fired, String error) {

    public static RuleOutcome of(boolean fired) {
        return new RuleOutcome(true, fired, null);
    }

    public static RuleOutcome failure(String error) {
        return new RuleOutcome(false, false, error);
    }
}
