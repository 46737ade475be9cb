package com.formula.control;

import com.formula.analysis.FieldInfo;
import com.formula.analysis.ResultType;
import com.formula.analysis.ValidationResult;
import com.formula.dependency.CycleResult;
import com.formula.dependency.DependencyResult;
import com.formula.engine.FormulaEngine;
import com.formula.governance.GovernanceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Design-time policy for control rules: a rule may only be stored when its formula
 * passes governance and infers as BOOLEAN.
 */
public class ControlRuleValidator {

    private static final Logger log = LoggerFactory.getLogger(ControlRuleValidator.class);

    private final FormulaEngine engine;

    public ControlRuleValidator(FormulaEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    /**
     * Validate a control rule formula.
     *
     * @param ruleType            Governed UI state
     * @param targetFieldId       Field the rule is attached to
     * @param formulaText         Formula text; blank clears the rule
     * @param fields              Schema field snapshot
     * @param formulaDependencies Schema-wide dependency map, or null to skip cycle checking
     * @return Verdict with diagnostics
     */
    public ControlRuleResult validateControlRule(ControlRuleType ruleType, String targetFieldId, String formulaText,
                                                 Collection<FieldInfo> fields,
                                                 Map<String, ? extends Collection<String>> formulaDependencies) {
        Objects.requireNonNull(ruleType, "ruleType cannot be null");
        Objects.requireNonNull(targetFieldId, "targetFieldId cannot be null");
        Objects.requireNonNull(fields, "fields cannot be null");

        if (formulaText == null || formulaText.isBlank()) {
            log.debug("{} rule on '{}' cleared", ruleType, targetFieldId);
            return ControlRuleResult.cleared();
        }

        ValidationResult validation = engine.validate(formulaText, fields);
        DependencyResult dependencies = engine.analyzeDependencies(formulaText, fields);
        CycleResult cycles = formulaDependencies == null ? null : engine.detectCycles(formulaDependencies);
        GovernanceResult governance = engine.evaluateGovernance(formulaText, validation, cycles);

        ControlRuleDiagnostics diagnostics =
                new ControlRuleDiagnostics(validation, dependencies, cycles, governance);
        ControlRuleResult result = classify(governance, validation, diagnostics,
                new ControlRule(ruleType, targetFieldId, formulaText));

        log.debug("{} rule on '{}' -> {}", ruleType, targetFieldId, result.status());
        return result;
    }

    /**
     * Same classification as {@link #validateControlRule} without cycle checking.
     * An ALLOWED result carries no rule object.
     */
    public ControlRuleResult canApplyControlRule(ControlRuleType ruleType, String formulaText,
                                                 Collection<FieldInfo> fields) {
        Objects.requireNonNull(ruleType, "ruleType cannot be null");
        Objects.requireNonNull(fields, "fields cannot be null");

        if (formulaText == null || formulaText.isBlank()) {
            return ControlRuleResult.cleared();
        }

        ValidationResult validation = engine.validate(formulaText, fields);
        GovernanceResult governance = engine.evaluateGovernance(formulaText, validation, null);
        ControlRuleDiagnostics diagnostics = new ControlRuleDiagnostics(validation, null, null, governance);
        return classify(governance, validation, diagnostics, null);
    }

    /**
     * Explicitly remove the rule of the given type from a field.
     */
    public ControlRuleResult clearControlRule(ControlRuleType ruleType, String targetFieldId) {
        Objects.requireNonNull(ruleType, "ruleType cannot be null");
        Objects.requireNonNull(targetFieldId, "targetFieldId cannot be null");
        log.debug("{} rule on '{}' cleared", ruleType, targetFieldId);
        return ControlRuleResult.cleared();
    }

    private ControlRuleResult classify(GovernanceResult governance, ValidationResult validation,
                                       ControlRuleDiagnostics diagnostics, ControlRule rule) {
        if (governance.isBlocking()) {
            return ControlRuleResult.blocked(
                    "Formula has errors: " + String.join(", ", governance.blockingReasons()), diagnostics);
        }
        if (validation.inferredType() != ResultType.BOOLEAN) {
            return ControlRuleResult.blocked(
                    "Control rules require BOOLEAN formulas. Inferred type: " + validation.inferredType(),
                    diagnostics);
        }
        return ControlRuleResult.allowed(rule, diagnostics);
    }
}
