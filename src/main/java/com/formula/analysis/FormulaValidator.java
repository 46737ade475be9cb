package com.formula.analysis;

import com.formula.ast.Expression;
import com.formula.exception.FormulaSyntaxException;
import com.formula.expression.FormulaParser;
import com.formula.function.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Validates formula text against a field snapshot.
 * <p>
 * Parse, then extract references, then check names, then infer the type. Malformed
 * formulas never throw: they come back as an invalid {@link ValidationResult}.
 */
public class FormulaValidator {

    private static final Logger log = LoggerFactory.getLogger(FormulaValidator.class);

    /**
     * Validate a formula.
     *
     * @param formula Formula text, may be null or blank
     * @param fields  Field snapshot the formula may reference
     * @return Validation result; identical inputs yield equal results
     */
    public ValidationResult validate(String formula, Collection<FieldInfo> fields) {
        if (formula == null || formula.isBlank()) {
            return ValidationResult.empty();
        }

        Expression expression;
        try {
            expression = FormulaParser.parse(formula);
        } catch (FormulaSyntaxException e) {
            log.debug("Formula '{}' rejected: {}", formula, e.getMessage());
            return ValidationResult.syntaxError(syntaxErrorMessage(e));
        }

        Map<String, FieldInfo> fieldsById = FieldInfo.index(fields);
        SortedSet<String> references = ReferenceExtractor.fieldReferences(expression);

        List<String> errors = new ArrayList<>();
        for (String reference : references) {
            if (!fieldsById.containsKey(reference)) {
                errors.add("Unknown field: '" + reference + "'");
            }
        }
        for (String function : ReferenceExtractor.functionNames(expression)) {
            if (!FunctionRegistry.isBuiltin(function)) {
                errors.add("Unknown function: '" + function + "'. Allowed: "
                        + FunctionRegistry.allowedNamesText());
            }
        }

        TypeInference inference = new TypeInferencer(fieldsById).infer(expression);
        ValidationResult result = ValidationResult.of(errors, inference.warnings(), references, inference.type());

        log.debug("Validated formula '{}': valid={}, type={}, errors={}, warnings={}",
                formula, result.valid(), result.inferredType(), errors.size(), inference.warnings().size());
        return result;
    }

    /**
     * User-facing text for a parse failure.
     */
    public static String syntaxErrorMessage(FormulaSyntaxException e) {
        return "Syntax error: " + e.getMessage();
    }
}
