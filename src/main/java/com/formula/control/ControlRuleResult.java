package com.formula.control;

import java.util.Objects;
import java.util.Optional;

/**
 * Verdict on a design-time control rule.
 *
 * @param status      ALLOWED, BLOCKED or CLEARED
 * @param rule        Rule to store; present only when ALLOWED by full validation
 * @param blockReason User-facing reason; present only when BLOCKED
 * @param diagnostics Analysis behind the verdict; null when CLEARED
 */
public record ControlRuleResult(
        ControlRuleStatus status,
        ControlRule rule,
        String blockReason,
        ControlRuleDiagnostics diagnostics
) {
    public ControlRuleResult {
        Objects.requireNonNull(status, "status cannot be null");
    }

    public static ControlRuleResult allowed(ControlRule rule, ControlRuleDiagnostics diagnostics) {
        return new ControlRuleResult(ControlRuleStatus.ALLOWED, rule, null, diagnostics);
    }

    public static ControlRuleResult blocked(String reason, ControlRuleDiagnostics diagnostics) {
        return new ControlRuleResult(ControlRuleStatus.BLOCKED, null, reason, diagnostics);
    }

    public static ControlRuleResult cleared() {
        return new ControlRuleResult(ControlRuleStatus.CLEARED, null, null, null);
    }

    public boolean isAllowed() {
        return status == ControlRuleStatus.ALLOWED;
    }

    public Optional<ControlRule> getRule() {
        return Optional.ofNullable(rule);
    }

    public Optional<String> getBlockReason() {
        return Optional.ofNullable(blockReason);
    }
}
