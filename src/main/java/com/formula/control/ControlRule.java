package com.formula.control;

import java.util.Objects;

/**
 * Design-time control rule. Identity is {@code (targetFieldId, ruleType)}.
 *
 * @param ruleType      Governed UI state
 * @param targetFieldId Field the rule is attached to
 * @param formulaText   BOOLEAN formula
 */
public record ControlRule(ControlRuleType ruleType, String targetFieldId, String formulaText) {

    public ControlRule {
        Objects.requireNonNull(ruleType, "ruleType cannot be null");
        Objects.requireNonNull(targetFieldId, "targetFieldId cannot be null");
        if (targetFieldId.isBlank()) {
            throw new IllegalArgumentException("targetFieldId cannot be blank");
        }
        formulaText = formulaText == null ? "" : formulaText;
    }

    /**
     * Convert a preview submission.
     *
     * @throws IllegalArgumentException if the rule type is unknown or the target is blank
     */
    public static ControlRule from(PreviewInput input) {
        Objects.requireNonNull(input, "input cannot be null");
        return new ControlRule(ControlRuleType.fromString(input.ruleType()),
                input.targetFieldId(), input.formulaText());
    }
}
