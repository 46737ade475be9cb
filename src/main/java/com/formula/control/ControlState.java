package com.formula.control;

/**
 * Run-time UI state of a field derived from its control rules.
 *
 * @param success      False when at least one rule could not be evaluated
 * @param visible      Whether the field is shown
 * @param enabled      Whether the field accepts input
 * @param required     Whether a value is mandatory
 * @param errorMessage Failures of skipped rules, null on success
 */
public record ControlState(boolean success, boolean visible, boolean enabled, boolean required,
                           String errorMessage) {

    public static ControlState defaults() {
        return new ControlState(true, true, true, false, null);
    }
}
