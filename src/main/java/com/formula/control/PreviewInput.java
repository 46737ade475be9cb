package com.formula.control;

/**
 * Raw rule as submitted for preview, before conversion into a {@link ControlRule}.
 *
 * @param ruleType      Rule type name (VISIBILITY, ENABLED, REQUIRED)
 * @param targetFieldId Field the rule is attached to
 * @param formulaText   Formula text, may be blank
 */
public record PreviewInput(String ruleType, String targetFieldId, String formulaText) {
}
