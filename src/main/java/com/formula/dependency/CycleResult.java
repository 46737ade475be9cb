package com.formula.dependency;

import java.util.List;

/**
 * Outcome of cycle detection over a schema-wide dependency map.
 *
 * @param hasCycle           Whether any cycle exists
 * @param cycleMembers       Field ids of the first cycle, empty when none
 * @param cycles             Every distinct cycle found, ordered by display path
 * @param analyzedFieldCount Number of fields in the analyzed map
 */
public record CycleResult(
        boolean hasCycle,
        List<String> cycleMembers,
        List<Cycle> cycles,
        int analyzedFieldCount
) {
    public CycleResult {
        cycleMembers = List.copyOf(cycleMembers);
        cycles = List.copyOf(cycles);
    }

    public static CycleResult none(int analyzedFieldCount) {
        return new CycleResult(false, List.of(), List.of(), analyzedFieldCount);
    }

    public static CycleResult of(List<Cycle> cycles, int analyzedFieldCount) {
        if (cycles.isEmpty()) {
            return none(analyzedFieldCount);
        }
        return new CycleResult(true, cycles.get(0).fieldIds(), cycles, analyzedFieldCount);
    }
}
