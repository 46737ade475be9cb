package com.formula.effect;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Run-time rule: when {@code condition} evaluates to true, {@code effect} applies.
 *
 * @param id             Rule id, letters, digits, '_' and '-'
 * @param nameKey        Translation key of the display name
 * @param condition      BOOLEAN formula
 * @param effect         Effect applied when the condition holds
 * @param enabled        Disabled rules are skipped
 * @param priority       Higher priorities are evaluated first and win conflicts
 * @param descriptionKey Optional translation key of a description
 */
public record RuntimeControlRule(
        String id,
        String nameKey,
        String condition,
        ControlEffect effect,
        boolean enabled,
        int priority,
        String descriptionKey
) {
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    public RuntimeControlRule {
        Objects.requireNonNull(id, "id cannot be null");
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid rule id '" + id
                    + "': only letters, digits, '_' and '-' are allowed");
        }
        Objects.requireNonNull(nameKey, "nameKey cannot be null");
        if (condition == null || condition.isBlank()) {
            throw new IllegalArgumentException("Rule '" + id + "' has an empty condition");
        }
        Objects.requireNonNull(effect, "effect cannot be null");
    }

    public RuntimeControlRule(String id, String nameKey, String condition, ControlEffect effect,
                              boolean enabled, int priority) {
        this(id, nameKey, condition, effect, enabled, priority, null);
    }
}
