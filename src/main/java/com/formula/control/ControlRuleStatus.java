package com.formula.control;

import java.util.Locale;

/**
 * Outcome of design-time control rule validation.
 */
public enum ControlRuleStatus {
    /** Formula may be stored as a control rule. */
    ALLOWED,
    /** Formula is rejected; see the block reason. */
    BLOCKED,
    /** Empty formula: the rule is removed. */
    CLEARED;

    public static ControlRuleStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Control rule status cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown control rule status: '" + value + "'", e);
        }
    }
}
