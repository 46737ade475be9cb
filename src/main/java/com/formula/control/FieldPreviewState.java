package com.formula.control;

import java.util.List;
import java.util.Map;

/**
 * Previewed UI state of one field after applying its control rules.
 *
 * @param fieldId           Field id
 * @param visible           Visibility after VISIBILITY rules (default true)
 * @param enabled           Enabled state after ENABLED rules (default true)
 * @param requiredIndicator Required marker after REQUIRED rules (default false)
 * @param appliedRules      Rule types that executed and were applied, in input order
 * @param blockedRules      Block reasons of rejected rules by rule type
 * @param failedRules       Execution errors of allowed rules by rule type
 */
public record FieldPreviewState(
        String fieldId,
        boolean visible,
        boolean enabled,
        boolean requiredIndicator,
        List<ControlRuleType> appliedRules,
        Map<ControlRuleType, String> blockedRules,
        Map<ControlRuleType, String> failedRules
) {
    public FieldPreviewState {
        appliedRules = List.copyOf(appliedRules);
        blockedRules = Map.copyOf(blockedRules);
        failedRules = Map.copyOf(failedRules);
    }
}
