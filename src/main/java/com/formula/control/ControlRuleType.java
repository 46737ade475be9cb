package com.formula.control;

import java.util.Locale;

/**
 * UI state a design-time control rule governs.
 */
public enum ControlRuleType {
    VISIBILITY,
    ENABLED,
    REQUIRED;

    /**
     * Parse a rule type name, case-insensitive.
     *
     * @throws IllegalArgumentException if the name is not a known rule type
     */
    public static ControlRuleType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Control rule type cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown control rule type: '" + value
                    + "'. Expected one of VISIBILITY, ENABLED, REQUIRED", e);
        }
    }
}
