package com.formula.engine;

import com.formula.analysis.FieldInfo;
import com.formula.analysis.ResultType;
import com.formula.analysis.ValidationResult;
import com.formula.ast.Expression;
import com.formula.dependency.CycleResult;
import com.formula.dependency.DependencyResult;
import com.formula.execution.ExecutionResult;
import com.formula.function.FormulaFunction;
import com.formula.governance.GovernanceResult;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * Entry point to the formula language: parsing, static analysis, governance and execution.
 * Implementations are stateless and safe to share between threads.
 */
public interface FormulaEngine {

    /**
     * Parse a formula.
     *
     * @throws com.formula.exception.FormulaSyntaxException if the formula is blank or malformed
     */
    Expression parse(String formula);

    /**
     * Validate a formula against a field snapshot. Never throws on malformed formulas.
     */
    ValidationResult validate(String formula, Collection<FieldInfo> fields);

    /**
     * Inferred result type, UNKNOWN for blank or unparseable formulas.
     */
    ResultType inferType(String formula, Collection<FieldInfo> fields);

    /**
     * Field ids referenced by a formula, without full validation.
     */
    SortedSet<String> fieldReferences(String formula);

    DependencyResult analyzeDependencies(String formula, Collection<FieldInfo> fields);

    /**
     * Detect cycles in a schema-wide {@code field id -> dependencies} map.
     */
    CycleResult detectCycles(Map<String, ? extends Collection<String>> dependencies);

    /**
     * Governance verdict for a formula.
     *
     * @param dependencies Schema-wide dependency map, or null to skip cycle checking
     */
    GovernanceResult evaluateGovernance(String formula, Collection<FieldInfo> fields,
                                        Map<String, ? extends Collection<String>> dependencies);

    /**
     * Governance verdict from results the caller already holds.
     *
     * @param cycles Cycle result, or null when cycle checking was skipped
     */
    GovernanceResult evaluateGovernance(String formula, ValidationResult validation, CycleResult cycles);

    ExecutionResult execute(String formula, Map<String, ?> values);

    /**
     * Execute with additional callables. Built-in functions cannot be overridden.
     */
    ExecutionResult execute(String formula, Map<String, ?> values, Map<String, FormulaFunction> extraFunctions);

    /**
     * Names of the built-in functions, sorted.
     */
    Set<String> availableFunctions();
}
