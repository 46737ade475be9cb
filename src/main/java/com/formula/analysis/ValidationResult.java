package com.formula.analysis;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of validating a formula against a field snapshot.
 *
 * @param valid           True when there are no errors
 * @param errors          Blocking errors, in deterministic order
 * @param warnings        Non-blocking warnings
 * @param fieldReferences Field ids the formula refers to, sorted
 * @param inferredType    Inferred result type
 */
public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        SortedSet<String> fieldReferences,
        ResultType inferredType
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        fieldReferences = Collections.unmodifiableSortedSet(new TreeSet<>(fieldReferences));
    }

    /**
     * Result for an empty or whitespace-only formula.
     */
    public static ValidationResult empty() {
        return new ValidationResult(true, List.of(), List.of(), new TreeSet<>(), ResultType.UNKNOWN);
    }

    public static ValidationResult syntaxError(String message) {
        return new ValidationResult(false, List.of(message), List.of(), new TreeSet<>(), ResultType.UNKNOWN);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings,
                                      Set<String> fieldReferences, ResultType inferredType) {
        return new ValidationResult(errors.isEmpty(), errors, warnings, new TreeSet<>(fieldReferences),
                inferredType);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
