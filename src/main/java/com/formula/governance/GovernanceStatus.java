package com.formula.governance;

import java.util.Locale;

/**
 * Verdict of the governance layer.
 */
public enum GovernanceStatus {
    VALID,
    VALID_WITH_WARNINGS,
    INVALID,
    EMPTY;

    /**
     * Parse a status name (case-insensitive, '-' accepted for '_').
     *
     * @throws IllegalArgumentException if the name is not a known status
     */
    public static GovernanceStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Governance status cannot be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown governance status: '" + value + "'", e);
        }
    }
}
