package com.formula.control;

/**
 * Outcome of previewing a control rule against sample values.
 *
 * @param ruleInput        The submitted rule
 * @param validationStatus Design-time verdict
 * @param blockReason      Reason when BLOCKED
 * @param executionResult  Boolean outcome; null unless ALLOWED and executed successfully
 * @param executionError   Execution failure message for an ALLOWED rule
 */
public record PreviewResult(
        PreviewInput ruleInput,
        ControlRuleStatus validationStatus,
        String blockReason,
        Boolean executionResult,
        String executionError
) {
    public boolean executed() {
        return executionResult != null;
    }
}
