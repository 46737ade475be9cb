package com.formula.effect;

import java.util.List;

/**
 * Effects of the rules that fired, in priority order, plus per-rule errors.
 * A new instance is produced for every evaluation.
 */
public record EvaluationResult(List<ControlEffect> effects, List<String> errors) {

    public EvaluationResult {
        effects = List.copyOf(effects);
        errors = List.copyOf(errors);
    }

    public boolean hasEffects() {
        return !effects.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Effects targeting one field, in priority order.
     */
    public List<ControlEffect> effectsFor(String targetFieldId) {
        return effects.stream()
                .filter(effect -> effect.targetFieldId().equals(targetFieldId))
                .toList();
    }
}
