package com.formula.effect;

import com.formula.core.Values;
import com.formula.engine.FormulaEngine;
import com.formula.execution.ExecutionResult;
import com.formula.function.FormulaFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Run-time rule engine: decides which control effects apply to a set of field values.
 * <p>
 * Rules run in descending priority; ties keep their input order. A rule whose condition
 * cannot be evaluated contributes an error instead of an effect and never stops the others.
 */
public class ControlEffectEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ControlEffectEvaluator.class);

    private static final Comparator<RuntimeControlRule> BY_PRIORITY_DESC =
            Comparator.comparingInt(RuntimeControlRule::priority).reversed();

    private final FormulaEngine engine;

    public ControlEffectEvaluator(FormulaEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    public EvaluationResult evaluateRules(List<RuntimeControlRule> rules, Map<String, ?> fieldValues) {
        return evaluateRules(rules, fieldValues, Map.of());
    }

    /**
     * Evaluate every enabled rule and collect the effects of those that fire.
     *
     * @param rules       Rules in any order
     * @param fieldValues Current values keyed by field id
     * @param functions   Extra callables available to conditions
     * @return Effects in priority order and rule-tagged errors
     */
    public EvaluationResult evaluateRules(List<RuntimeControlRule> rules, Map<String, ?> fieldValues,
                                          Map<String, FormulaFunction> functions) {
        Objects.requireNonNull(rules, "rules cannot be null");
        Objects.requireNonNull(fieldValues, "fieldValues cannot be null");

        List<RuntimeControlRule> ordered = new ArrayList<>(rules);
        ordered.sort(BY_PRIORITY_DESC);

        List<ControlEffect> effects = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (RuntimeControlRule rule : ordered) {
            if (!rule.enabled()) {
                log.debug("Rule '{}' is disabled, skipping", rule.id());
                continue;
            }
            RuleOutcome outcome = evaluateRule(rule, fieldValues, functions);
            if (!outcome.success()) {
                log.warn("{}", outcome.error());
                errors.add(outcome.error());
            } else if (outcome.fired()) {
                effects.add(rule.effect());
            }
        }

        log.debug("Evaluated {} rules: {} effects, {} errors", rules.size(), effects.size(), errors.size());
        return new EvaluationResult(effects, errors);
    }

    public RuleOutcome evaluateRule(RuntimeControlRule rule, Map<String, ?> fieldValues) {
        return evaluateRule(rule, fieldValues, Map.of());
    }

    /**
     * Evaluate a single rule's condition. A disabled rule does not fire and is not evaluated.
     */
    public RuleOutcome evaluateRule(RuntimeControlRule rule, Map<String, ?> fieldValues,
                                    Map<String, FormulaFunction> functions) {
        Objects.requireNonNull(rule, "rule cannot be null");
        if (!rule.enabled()) {
            return RuleOutcome.of(false);
        }

        ExecutionResult result = engine.execute(rule.condition(), fieldValues, functions);
        if (!result.success()) {
            return RuleOutcome.failure(failure(rule, result.error()));
        }
        if (!(result.value() instanceof Boolean fired)) {
            return RuleOutcome.failure(failure(rule,
                    "Condition must evaluate to boolean, got " + Values.typeName(result.value())));
        }
        log.debug("Rule '{}' condition evaluated to {}", rule.id(), fired);
        return RuleOutcome.of(fired);
    }

    /**
     * Keep the first effect per target field. Given priority-ordered input, the
     * highest-priority effect wins. Applying this twice changes nothing.
     */
    public List<ControlEffect> resolveConflicts(List<ControlEffect> effects) {
        Set<String> seen = new HashSet<>();
        List<ControlEffect> resolved = new ArrayList<>();
        for (ControlEffect effect : effects) {
            if (seen.add(effect.targetFieldId())) {
                resolved.add(effect);
            }
        }
        return List.copyOf(resolved);
    }

    private static String failure(RuntimeControlRule rule, String detail) {
        return "Rule '" + rule.id() + "' condition evaluation failed: " + detail;
    }
}
