package com.formula;

import com.formula.analysis.FieldInfo;
import com.formula.config.ConfigLoader;
import com.formula.config.RuleSetConfig;
import com.formula.control.ControlRule;
import com.formula.control.ControlRulePreviewer;
import com.formula.control.ControlRuleResult;
import com.formula.control.ControlRuleStatus;
import com.formula.control.ControlRuleType;
import com.formula.control.ControlRuleValidator;
import com.formula.control.ControlState;
import com.formula.control.ControlStateEvaluator;
import com.formula.control.PreviewInput;
import com.formula.control.PreviewResult;
import com.formula.core.FieldValuesFactory;
import com.formula.effect.ControlEffect;
import com.formula.effect.ControlEffectEvaluator;
import com.formula.effect.ControlType;
import com.formula.effect.EvaluationResult;
import com.formula.engine.DefaultFormulaEngine;
import com.formula.engine.FormulaEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over the bundled order-form rule set.
 * Tests cover:
 * - Design-time validation of control rules
 * - Preview of a rule against sample values
 * - Run-time evaluation of the configured rule set
 * - Conflict resolution by priority
 */
class FormulaApplicationTest {

    private FormulaEngine engine;
    private RuleSetConfig ruleSet;
    private List<FieldInfo> schema;

    @BeforeEach
    void setUp() {
        engine = new DefaultFormulaEngine();
        ruleSet = ConfigLoader.load("classpath:control-rules.yaml");
        schema = List.of(
                FieldInfo.of("quantity", "NUMBER"),
                FieldInfo.of("unit_price", "NUMBER"),
                FieldInfo.of("is_active", "CHECKBOX"),
                FieldInfo.of("discount", "NUMBER"),
                FieldInfo.of("notes", "TEXTAREA")
        );
    }

    private static Map<String, Object> order(int quantity, double unitPrice, boolean active) {
        return FieldValuesFactory.fromJson("{\"quantity\": " + quantity + ", \"unit_price\": " + unitPrice
                + ", \"is_active\": " + active + ", \"discount\": 0, \"notes\": \"\"}");
    }

    // =====================================================================
    // Design time
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Every configured condition is an allowed control rule")
    @CsvSource({
            "hide-discount-inactive",
            "show-discount-bulk",
            "bulk-discount-rate",
            "lock-notes-large-order"
    })
    void configuredConditionsAreAllowed(String ruleId) {
        ControlRuleValidator validator = new ControlRuleValidator(engine);
        String condition = ruleSet.getRule(ruleId).orElseThrow().condition();

        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.VISIBILITY, "discount", condition, schema, Map.of());

        assertEquals(ControlRuleStatus.ALLOWED, result.status(), () -> result.blockReason());
    }

    @Test
    @DisplayName("Preview runs an allowed rule against sample values")
    void previewRule() {
        ControlRulePreviewer previewer = new ControlRulePreviewer(new ControlRuleValidator(engine), engine);

        PreviewResult result = previewer.preview(
                new PreviewInput("ENABLED", "discount", "quantity >= 10"), schema, order(12, 12.5, true));

        assertEquals(ControlRuleStatus.ALLOWED, result.validationStatus());
        assertEquals(Boolean.TRUE, result.executionResult());
    }

    @Test
    @DisplayName("Stored rules of a field yield its current state")
    void fieldState() {
        ControlStateEvaluator evaluator = new ControlStateEvaluator(engine);
        List<ControlRule> rules = List.of(
                new ControlRule(ControlRuleType.VISIBILITY, "discount", "is_active"),
                new ControlRule(ControlRuleType.REQUIRED, "discount", "quantity >= 10")
        );

        ControlState state = evaluator.evaluate(rules, order(12, 1.0, false));

        assertTrue(state.success());
        assertFalse(state.visible());
        assertTrue(state.required());
    }

    // =====================================================================
    // Run time
    // =====================================================================

    @Test
    @DisplayName("Bulk order from an active customer shows the discount and sets the rate")
    void bulkOrder() {
        ControlEffectEvaluator evaluator = new ControlEffectEvaluator(engine);

        EvaluationResult result = evaluator.evaluateRules(ruleSet.rules(), order(12, 12.5, true));

        assertFalse(result.hasErrors());
        assertEquals(2, result.effects().size());
        assertEquals(ControlEffect.visibility("discount", true), result.effects().get(0));
        assertEquals(ControlType.VALUE_SET, result.effects().get(1).controlType());
        assertEquals(5, ((Number) result.effects().get(1).value()).intValue());
    }

    @Test
    @DisplayName("Inactive customer hides the discount regardless of lower-priority rules")
    void inactiveCustomer() {
        ControlEffectEvaluator evaluator = new ControlEffectEvaluator(engine);

        EvaluationResult result = evaluator.evaluateRules(ruleSet.rules(), order(12, 12.5, false));
        List<ControlEffect> resolved = evaluator.resolveConflicts(result.effects());

        assertEquals(ControlEffect.visibility("discount", false), result.effects().get(0));
        assertEquals(List.of(ControlEffect.visibility("discount", false)), resolved);
    }

    @Test
    @DisplayName("Small order fires nothing")
    void smallOrder() {
        ControlEffectEvaluator evaluator = new ControlEffectEvaluator(engine);

        EvaluationResult result = evaluator.evaluateRules(ruleSet.rules(), order(2, 3.0, true));

        assertFalse(result.hasEffects());
        assertFalse(result.hasErrors());
    }
}
