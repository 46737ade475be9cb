package com.formula.governance;

import com.formula.analysis.ValidationResult;
import com.formula.dependency.Cycle;
import com.formula.dependency.CycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns validation and cycle signals into a single verdict.
 * <p>
 * Order: empty, validation errors, cycles, warnings, valid. Validation errors always
 * win over a detected cycle.
 */
public class GovernanceEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEvaluator.class);

    /**
     * @param formula    Formula text
     * @param validation Validation result for {@code formula}
     * @param cycles     Cycle result, or null when cycle checking was skipped
     * @return Governance verdict
     */
    public GovernanceResult evaluate(String formula, ValidationResult validation, CycleResult cycles) {
        if (formula == null || formula.isBlank()) {
            return GovernanceResult.empty();
        }
        Objects.requireNonNull(validation, "validation cannot be null");

        if (!validation.valid()) {
            return GovernanceResult.invalid(validation.errors(), validation.warnings());
        }

        if (cycles != null && cycles.hasCycle()) {
            List<String> reasons = new ArrayList<>();
            for (Cycle cycle : cycles.cycles()) {
                reasons.add("Circular dependency detected: " + cycle.path());
            }
            log.debug("Formula '{}' blocked by {} dependency cycle(s)", formula, reasons.size());
            return GovernanceResult.invalid(reasons, validation.warnings());
        }

        if (validation.hasWarnings()) {
            return new GovernanceResult(GovernanceStatus.VALID_WITH_WARNINGS, List.of(), validation.warnings());
        }
        return new GovernanceResult(GovernanceStatus.VALID, List.of(), List.of());
    }
}
