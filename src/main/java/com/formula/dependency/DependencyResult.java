package com.formula.dependency;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Fields a single formula depends on.
 *
 * @param fieldReferences Referenced field ids, sorted
 * @param dependencies    Per-reference details, in the order of {@code fieldReferences}
 * @param unknownFields   References missing from the snapshot
 * @param parseError      Syntax error when the formula does not parse, otherwise null
 */
public record DependencyResult(
        SortedSet<String> fieldReferences,
        List<FieldDependency> dependencies,
        SortedSet<String> unknownFields,
        String parseError
) {
    public DependencyResult {
        fieldReferences = Collections.unmodifiableSortedSet(new TreeSet<>(fieldReferences));
        dependencies = List.copyOf(dependencies);
        unknownFields = Collections.unmodifiableSortedSet(new TreeSet<>(unknownFields));
    }

    public static DependencyResult empty() {
        return new DependencyResult(new TreeSet<>(), List.of(), new TreeSet<>(), null);
    }

    public static DependencyResult parseFailure(String error) {
        return new DependencyResult(new TreeSet<>(), List.of(), new TreeSet<>(), error);
    }

    public Optional<String> getParseError() {
        return Optional.ofNullable(parseError);
    }

    public boolean hasUnknownFields() {
        return !unknownFields.isEmpty();
    }
}
