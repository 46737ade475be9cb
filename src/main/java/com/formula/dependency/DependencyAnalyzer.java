package com.formula.dependency;

import com.formula.analysis.FieldInfo;
import com.formula.analysis.FormulaValidator;
import com.formula.analysis.ReferenceExtractor;
import com.formula.exception.FormulaSyntaxException;
import com.formula.expression.FormulaParser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Answers dependency questions about formulas without running full validation.
 */
public class DependencyAnalyzer {

    /**
     * Field ids referenced by a formula.
     *
     * @return Sorted field ids; empty for blank or unparseable formulas
     */
    public SortedSet<String> fieldReferences(String formula) {
        if (formula == null || formula.isBlank()) {
            return Collections.emptySortedSet();
        }
        try {
            return ReferenceExtractor.fieldReferences(FormulaParser.parse(formula));
        } catch (FormulaSyntaxException e) {
            return Collections.emptySortedSet();
        }
    }

    /**
     * Dependencies of a formula, classified against a field snapshot.
     */
    public DependencyResult analyze(String formula, Collection<FieldInfo> fields) {
        if (formula == null || formula.isBlank()) {
            return DependencyResult.empty();
        }

        SortedSet<String> references;
        try {
            references = ReferenceExtractor.fieldReferences(FormulaParser.parse(formula));
        } catch (FormulaSyntaxException e) {
            return DependencyResult.parseFailure(FormulaValidator.syntaxErrorMessage(e));
        }

        Map<String, FieldInfo> fieldsById = FieldInfo.index(fields);
        List<FieldDependency> dependencies = new ArrayList<>();
        SortedSet<String> unknown = new TreeSet<>();
        for (String reference : references) {
            FieldInfo field = fieldsById.get(reference);
            if (field == null) {
                unknown.add(reference);
                dependencies.add(new FieldDependency(reference, false, null));
            } else {
                dependencies.add(new FieldDependency(reference, true, field.fieldType()));
            }
        }
        return new DependencyResult(references, dependencies, unknown, null);
    }

    /**
     * Build the schema-wide {@code field id -> referenced field ids} map used for cycle detection.
     * Unparseable formulas contribute no edges.
     *
     * @param formulasByField Formula text keyed by the id of the field that owns it
     * @return Sorted dependency map
     */
    public Map<String, SortedSet<String>> dependencyMap(Map<String, String> formulasByField) {
        Map<String, SortedSet<String>> map = new TreeMap<>();
        for (Map.Entry<String, String> entry : formulasByField.entrySet()) {
            map.put(entry.getKey(), fieldReferences(entry.getValue()));
        }
        return map;
    }
}
