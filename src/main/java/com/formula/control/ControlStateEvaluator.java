package com.formula.control;

import com.formula.core.Values;
import com.formula.engine.FormulaEngine;
import com.formula.execution.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates the stored control rules of one field against current values.
 * A rule that fails to evaluate is skipped and the field keeps its previous state.
 */
public class ControlStateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ControlStateEvaluator.class);

    private final FormulaEngine engine;

    public ControlStateEvaluator(FormulaEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    /**
     * @param rules       Control rules of a single field, applied in list order
     * @param fieldValues Current values keyed by field id
     * @return Field state; defaults are visible, enabled and not required
     * @throws IllegalArgumentException if the rules target more than one field
     */
    public ControlState evaluate(List<ControlRule> rules, Map<String, ?> fieldValues) {
        Objects.requireNonNull(rules, "rules cannot be null");
        Objects.requireNonNull(fieldValues, "fieldValues cannot be null");
        long targets = rules.stream().map(ControlRule::targetFieldId).distinct().count();
        if (targets > 1) {
            throw new IllegalArgumentException("Control rules must target a single field, got " + targets);
        }

        boolean visible = true;
        boolean enabled = true;
        boolean required = false;
        List<String> errors = new ArrayList<>();

        for (ControlRule rule : rules) {
            if (rule.formulaText().isBlank()) {
                continue;
            }
            ExecutionResult result = engine.execute(rule.formulaText(), fieldValues);
            if (!result.success()) {
                log.warn("Skipping {} rule on '{}': {}", rule.ruleType(), rule.targetFieldId(), result.error());
                errors.add(rule.ruleType() + ": " + result.error());
                continue;
            }
            boolean value = Values.isTruthy(result.value());
            switch (rule.ruleType()) {
                case VISIBILITY -> visible = value;
                case ENABLED -> enabled = value;
                case REQUIRED -> required = value;
            }
        }

        if (errors.isEmpty()) {
            return new ControlState(true, visible, enabled, required, null);
        }
        return new ControlState(false, visible, enabled, required, String.join("; ", errors));
    }
}
