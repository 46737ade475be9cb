package com.formula.control;

import com.formula.analysis.ValidationResult;
import com.formula.dependency.CycleResult;
import com.formula.dependency.DependencyResult;
import com.formula.governance.GovernanceResult;

import java.util.Optional;

/**
 * Analysis attached to a control rule verdict. Never persisted with the rule.
 *
 * @param validationResult Validator output
 * @param dependencyResult Referenced fields, null for the lighter can-apply check
 * @param cycleResult      Cycle check, null when no dependency map was supplied
 * @param governanceResult Governance verdict
 */
public record ControlRuleDiagnostics(
        ValidationResult validationResult,
        DependencyResult dependencyResult,
        CycleResult cycleResult,
        GovernanceResult governanceResult
) {
    public Optional<DependencyResult> getDependencyResult() {
        return Optional.ofNullable(dependencyResult);
    }

    public Optional<CycleResult> getCycleResult() {
        return Optional.ofNullable(cycleResult);
    }
}
