package com.formula.governance;

import java.util.List;

/**
 * Governance verdict for one formula. Derived on demand, never stored.
 *
 * @param status          Verdict
 * @param blockingReasons Reasons for an INVALID verdict, empty otherwise
 * @param warnings        Validator warnings carried through for display
 */
public record GovernanceResult(GovernanceStatus status, List<String> blockingReasons, List<String> warnings) {

    public GovernanceResult {
        blockingReasons = List.copyOf(blockingReasons);
        warnings = List.copyOf(warnings);
    }

    public static GovernanceResult empty() {
        return new GovernanceResult(GovernanceStatus.EMPTY, List.of(), List.of());
    }

    public static GovernanceResult invalid(List<String> reasons, List<String> warnings) {
        return new GovernanceResult(GovernanceStatus.INVALID, reasons, warnings);
    }

    public boolean isBlocking() {
        return status == GovernanceStatus.INVALID;
    }
}
