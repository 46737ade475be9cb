package com.formula.control;

import com.formula.analysis.FieldInfo;
import com.formula.engine.DefaultFormulaEngine;
import com.formula.governance.GovernanceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ControlRuleValidator.
 */
class ControlRuleValidatorTest {

    private ControlRuleValidator validator;
    private List<FieldInfo> fields;

    @BeforeEach
    void setUp() {
        validator = new ControlRuleValidator(new DefaultFormulaEngine());
        fields = List.of(
                FieldInfo.of("a", "NUMBER"),
                FieldInfo.of("b", "NUMBER"),
                FieldInfo.of("is_active", "CHECKBOX"),
                FieldInfo.of("name", "TEXT"),
                FieldInfo.of("discount", "NUMBER")
        );
    }

    // =====================================================================
    // validateControlRule
    // =====================================================================

    @ParameterizedTest
    @DisplayName("NUMBER formula is blocked for every rule type")
    @EnumSource(ControlRuleType.class)
    void numericFormulaBlocked(ControlRuleType type) {
        ControlRuleResult result = validator.validateControlRule(type, "discount", "a + b", fields, null);

        assertEquals(ControlRuleStatus.BLOCKED, result.status());
        assertEquals("Control rules require BOOLEAN formulas. Inferred type: NUMBER", result.blockReason());
        assertTrue(result.getRule().isEmpty());
        assertNotNull(result.diagnostics());
    }

    @Test
    @DisplayName("BOOLEAN formula is allowed with the rule and diagnostics attached")
    void booleanFormulaAllowed() {
        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.VISIBILITY, "discount", "is_active and a > b", fields, null);

        assertEquals(ControlRuleStatus.ALLOWED, result.status());
        assertEquals(new ControlRule(ControlRuleType.VISIBILITY, "discount", "is_active and a > b"), result.rule());
        assertNull(result.blockReason());
        assertEquals(GovernanceStatus.VALID, result.diagnostics().governanceResult().status());
        assertEquals(List.of("a", "b", "is_active"),
                List.copyOf(result.diagnostics().dependencyResult().fieldReferences()));
        assertTrue(result.diagnostics().getCycleResult().isEmpty());
    }

    @Test
    @DisplayName("Blank formula clears the rule")
    void blankFormulaCleared() {
        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.REQUIRED, "discount", "   ", fields, null);

        assertEquals(ControlRuleStatus.CLEARED, result.status());
        assertNull(result.rule());
        assertNull(result.diagnostics());
    }

    @Test
    @DisplayName("Validation errors are joined into the block reason")
    void validationErrorsBlock() {
        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.ENABLED, "discount", "missing > 1 and is_empty(other)", fields, null);

        assertEquals(ControlRuleStatus.BLOCKED, result.status());
        assertEquals("Formula has errors: Unknown field: 'missing', Unknown field: 'other'", result.blockReason());
    }

    @Test
    @DisplayName("Syntax error blocks with the parser message")
    void syntaxErrorBlocks() {
        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.VISIBILITY, "discount", "a >", fields, null);

        assertEquals("Formula has errors: Syntax error: Unexpected end of formula at position 3",
                result.blockReason());
    }

    @Test
    @DisplayName("Dependency cycle blocks an otherwise valid formula")
    void cycleBlocks() {
        Map<String, List<String>> dependencies = Map.of(
                "a", List.of("b"),
                "b", List.of("a")
        );

        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.VISIBILITY, "discount", "a > b", fields, dependencies);

        assertEquals(ControlRuleStatus.BLOCKED, result.status());
        assertEquals("Formula has errors: Circular dependency detected: a -> b -> a", result.blockReason());
        assertTrue(result.diagnostics().getCycleResult().orElseThrow().hasCycle());
    }

    @Test
    @DisplayName("Warnings do not block a BOOLEAN formula")
    void warningsAllowed() {
        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.VISIBILITY, "discount", "name + 1 > 0", fields, null);

        assertEquals(ControlRuleStatus.ALLOWED, result.status());
        assertEquals(GovernanceStatus.VALID_WITH_WARNINGS, result.diagnostics().governanceResult().status());
    }

    @Test
    @DisplayName("UNKNOWN type is blocked")
    void unknownTypeBlocked() {
        ControlRuleResult result = validator.validateControlRule(
                ControlRuleType.VISIBILITY, "discount", "coalesce(null)", fields, null);

        assertEquals("Control rules require BOOLEAN formulas. Inferred type: UNKNOWN", result.blockReason());
    }

    // =====================================================================
    // canApplyControlRule / clearControlRule
    // =====================================================================

    @Test
    @DisplayName("can-apply classifies without returning a rule")
    void canApply() {
        ControlRuleResult allowed = validator.canApplyControlRule(ControlRuleType.ENABLED, "a > 1", fields);
        ControlRuleResult blocked = validator.canApplyControlRule(ControlRuleType.ENABLED, "a", fields);
        ControlRuleResult cleared = validator.canApplyControlRule(ControlRuleType.ENABLED, "", fields);

        assertEquals(ControlRuleStatus.ALLOWED, allowed.status());
        assertNull(allowed.rule());
        assertNull(allowed.diagnostics().dependencyResult());
        assertNull(allowed.diagnostics().cycleResult());
        assertEquals(ControlRuleStatus.BLOCKED, blocked.status());
        assertEquals(ControlRuleStatus.CLEARED, cleared.status());
    }

    @Test
    @DisplayName("Explicit clear returns CLEARED")
    void clear() {
        assertEquals(ControlRuleStatus.CLEARED,
                validator.clearControlRule(ControlRuleType.VISIBILITY, "discount").status());
    }

    @Test
    @DisplayName("Null arguments are programmer errors")
    void nullArguments() {
        assertThrows(NullPointerException.class,
                () -> validator.validateControlRule(null, "discount", "a > 1", fields, null));
        assertThrows(NullPointerException.class,
                () -> validator.validateControlRule(ControlRuleType.VISIBILITY, "discount", "a > 1", null, null));
    }

    @Test
    @DisplayName("Rule type strings are parsed at the boundary")
    void ruleTypeFromString() {
        assertEquals(ControlRuleType.ENABLED, ControlRuleType.fromString(" enabled "));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ControlRuleType.fromString("HIDDEN"));
        assertTrue(e.getMessage().contains("HIDDEN"));
        assertThrows(IllegalArgumentException.class, () -> ControlRuleStatus.fromString("PENDING"));
    }
}
