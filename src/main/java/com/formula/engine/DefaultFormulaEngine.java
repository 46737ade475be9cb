package com.formula.engine;

import com.formula.analysis.FieldInfo;
import com.formula.analysis.FormulaValidator;
import com.formula.analysis.ResultType;
import com.formula.analysis.ValidationResult;
import com.formula.ast.Expression;
import com.formula.dependency.CycleDetector;
import com.formula.dependency.CycleResult;
import com.formula.dependency.DependencyAnalyzer;
import com.formula.dependency.DependencyResult;
import com.formula.execution.ExecutionResult;
import com.formula.execution.FormulaExecutor;
import com.formula.expression.FormulaParser;
import com.formula.function.FormulaFunction;
import com.formula.function.FunctionRegistry;
import com.formula.governance.GovernanceEvaluator;
import com.formula.governance.GovernanceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Default implementation of FormulaEngine.
 * Wires the validator, dependency analysis, governance and executor together.
 */
public class DefaultFormulaEngine implements FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultFormulaEngine.class);

    private final FormulaValidator validator;
    private final DependencyAnalyzer dependencyAnalyzer;
    private final CycleDetector cycleDetector;
    private final GovernanceEvaluator governanceEvaluator;
    private final FormulaExecutor executor;

    public DefaultFormulaEngine() {
        this.validator = new FormulaValidator();
        this.dependencyAnalyzer = new DependencyAnalyzer();
        this.cycleDetector = new CycleDetector();
        this.governanceEvaluator = new GovernanceEvaluator();
        this.executor = new FormulaExecutor();

        log.info("FormulaEngine initialized with functions: {}", FunctionRegistry.allowedNamesText());
    }

    @Override
    public Expression parse(String formula) {
        return FormulaParser.parse(formula);
    }

    @Override
    public ValidationResult validate(String formula, Collection<FieldInfo> fields) {
        return validator.validate(formula, fields);
    }

    @Override
    public ResultType inferType(String formula, Collection<FieldInfo> fields) {
        return validator.validate(formula, fields).inferredType();
    }

    @Override
    public SortedSet<String> fieldReferences(String formula) {
        return dependencyAnalyzer.fieldReferences(formula);
    }

    @Override
    public DependencyResult analyzeDependencies(String formula, Collection<FieldInfo> fields) {
        return dependencyAnalyzer.analyze(formula, fields);
    }

    @Override
    public CycleResult detectCycles(Map<String, ? extends Collection<String>> dependencies) {
        return cycleDetector.detect(dependencies);
    }

    @Override
    public GovernanceResult evaluateGovernance(String formula, Collection<FieldInfo> fields,
                                               Map<String, ? extends Collection<String>> dependencies) {
        ValidationResult validation = validator.validate(formula, fields);
        CycleResult cycles = dependencies == null ? null : cycleDetector.detect(dependencies);
        return governanceEvaluator.evaluate(formula, validation, cycles);
    }

    @Override
    public GovernanceResult evaluateGovernance(String formula, ValidationResult validation, CycleResult cycles) {
        return governanceEvaluator.evaluate(formula, validation, cycles);
    }

    @Override
    public ExecutionResult execute(String formula, Map<String, ?> values) {
        return executor.execute(formula, values);
    }

    @Override
    public ExecutionResult execute(String formula, Map<String, ?> values,
                                   Map<String, FormulaFunction> extraFunctions) {
        return executor.execute(formula, values, visibleExtras(extraFunctions));
    }

    @Override
    public Set<String> availableFunctions() {
        return FunctionRegistry.names();
    }

    /**
     * Drop extras that collide with a built-in; the built-in always wins.
     */
    private Map<String, FormulaFunction> visibleExtras(Map<String, FormulaFunction> extraFunctions) {
        if (extraFunctions == null || extraFunctions.isEmpty()) {
            return Map.of();
        }
        Map<String, FormulaFunction> visible = new TreeMap<>();
        for (Map.Entry<String, FormulaFunction> entry : extraFunctions.entrySet()) {
            if (FunctionRegistry.isBuiltin(entry.getKey())) {
                log.warn("Ignoring extra function '{}': built-in functions cannot be overridden", entry.getKey());
            } else {
                visible.put(entry.getKey(), entry.getValue());
            }
        }
        return visible;
    }
}
