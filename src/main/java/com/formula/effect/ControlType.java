package com.formula.effect;

import java.util.Locale;

/**
 * Kind of change a run-time effect makes to a field.
 */
public enum ControlType {
    VALUE_SET,
    VISIBILITY,
    ENABLE;

    /**
     * Whether effects of this kind carry a boolean value.
     */
    public boolean requiresBoolean() {
        return this == VISIBILITY || this == ENABLE;
    }

    public static ControlType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Control type cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown control type: '" + value
                    + "'. Expected one of VALUE_SET, VISIBILITY, ENABLE", e);
        }
    }
}
