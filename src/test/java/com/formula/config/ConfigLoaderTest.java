package com.formula.config;

import com.formula.effect.ControlEffect;
import com.formula.effect.ControlType;
import com.formula.effect.RuntimeControlRule;
import com.formula.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading control rule sets from YAML.
 */
class ConfigLoaderTest {

    private static RuleSetConfig parse(String yaml) {
        return ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    // =====================================================================
    // Loading
    // =====================================================================

    @Test
    @DisplayName("Rule set loads from the classpath with defaults applied")
    void loadFromClasspath() {
        RuleSetConfig config = ConfigLoader.load("classpath:control-rules-test.yaml");

        assertEquals("test-rules", config.name());
        assertEquals("2.1", config.version());
        assertEquals(3, config.rules().size());

        RuntimeControlRule hide = config.getRule("hide-when-inactive").orElseThrow();
        assertEquals("rules.hide-when-inactive", hide.nameKey());
        assertNull(hide.descriptionKey());
        assertEquals(20, hide.priority());
        assertTrue(hide.enabled());
        assertEquals(ControlEffect.visibility("discount", false), hide.effect());

        RuntimeControlRule rate = config.getRule("default-rate").orElseThrow();
        assertEquals("rules.default_rate", rate.nameKey());
        assertEquals("rules.default_rate.description", rate.descriptionKey());
        assertEquals(0, rate.priority());
        assertEquals(ControlType.VALUE_SET, rate.effect().controlType());
        assertEquals(2.5, rate.effect().value());

        RuntimeControlRule disabled = config.getRule("disabled-rule").orElseThrow();
        assertFalse(disabled.enabled());
        assertEquals(5, disabled.priority());
        assertEquals(List.of("hide-when-inactive", "default-rate"),
                config.enabledRules().stream().map(RuntimeControlRule::id).toList());
    }

    @Test
    @DisplayName("Bundled order-form rules load")
    void loadBundledRules() {
        RuleSetConfig config = ConfigLoader.load("classpath:control-rules.yaml");

        assertEquals("order-form", config.name());
        assertFalse(config.rules().isEmpty());
    }

    @Test
    @DisplayName("Missing file fails with a configuration error")
    void missingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertTrue(e.getMessage().contains("does-not-exist.yaml"));
    }

    @Test
    @DisplayName("Rule set without a 'rule-set' root key is accepted")
    void rootLevelRuleSet() {
        RuleSetConfig config = parse("""
                name: flat
                rules:
                  - id: r1
                    condition: "a > 1"
                    effect: {type: ENABLE, target: a, value: true}
                """);

        assertEquals("flat", config.name());
        assertEquals("1.0", config.version());
        assertEquals(1, config.rules().size());
    }

    @Test
    @DisplayName("Rule set without rules is empty")
    void noRules() {
        assertTrue(parse("rule-set: {name: empty}").rules().isEmpty());
    }

    // =====================================================================
    // Malformed files
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Structurally malformed files are rejected")
    @ValueSource(strings = {
            "",
            "- just\n- a list",
            "rule-set: 42",
            "rules: not-a-list",
            "rules:\n  - plain string"
    })
    void malformedStructure(String yaml) {
        assertThrows(ConfigurationException.class, () -> parse(yaml));
    }

    @Test
    @DisplayName("Rule without an id is rejected")
    void missingId() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - condition: "true"
                    effect: {type: ENABLE, target: a, value: true}
                """));
        assertEquals("Rule at index 0 has no id", e.getMessage());
    }

    @Test
    @DisplayName("Rule without a condition is rejected")
    void missingCondition() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: r1
                    effect: {type: ENABLE, target: a, value: true}
                """));
        assertEquals("Rule 'r1' has no condition", e.getMessage());
    }

    @Test
    @DisplayName("Condition with a syntax error is rejected at load time")
    void invalidCondition() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: r1
                    condition: "a >"
                    effect: {type: ENABLE, target: a, value: true}
                """));
        assertTrue(e.getMessage().startsWith("Rule 'r1' has an invalid condition: "));
    }

    @Test
    @DisplayName("Effect problems are rejected")
    void invalidEffects() {
        assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: no-effect
                    condition: "true"
                """));
        assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: no-target
                    condition: "true"
                    effect: {type: ENABLE, value: true}
                """));
        assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: bad-type
                    condition: "true"
                    effect: {type: HIDE, target: a, value: true}
                """));
        assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: bad-value
                    condition: "true"
                    effect: {type: VISIBILITY, target: a, value: maybe}
                """));
    }

    @Test
    @DisplayName("Invalid id, non-numeric priority and duplicates are rejected")
    void invalidRuleAttributes() {
        assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: "bad id"
                    condition: "true"
                    effect: {type: ENABLE, target: a, value: true}
                """));
        assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: r1
                    condition: "true"
                    priority: high
                    effect: {type: ENABLE, target: a, value: true}
                """));

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: r1
                    condition: "true"
                    effect: {type: ENABLE, target: a, value: true}
                  - id: r1
                    condition: "false"
                    effect: {type: ENABLE, target: a, value: false}
                """));
        assertEquals("Duplicate rule id 'r1'", e.getMessage());
    }

    @ParameterizedTest
    @DisplayName("Fractional or non-numeric priority is rejected")
    @ValueSource(strings = {"3.7", "high", "1e10"})
    void priorityMustBeInteger(String priority) {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: r1
                    condition: "true"
                    priority: %s
                    effect: {type: ENABLE, target: a, value: true}
                """.formatted(priority)));
        assertEquals("Rule 'r1' has a non-integer priority: " + priority, e.getMessage());
    }

    @ParameterizedTest
    @DisplayName("Non-boolean enabled flag is rejected")
    @ValueSource(strings = {"nope", "1", "\"maybe\""})
    void enabledMustBeBoolean(String enabled) {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                rules:
                  - id: r1
                    condition: "true"
                    enabled: %s
                    effect: {type: ENABLE, target: a, value: true}
                """.formatted(enabled)));
        assertTrue(e.getMessage().startsWith("Rule 'r1' has a non-boolean enabled: "), e.getMessage());
    }

    @Test
    @DisplayName("Integral priority written as a string or decimal is accepted")
    void integralPriorityAccepted() {
        RuleSetConfig config = parse("""
                rules:
                  - id: r1
                    condition: "true"
                    priority: 4.0
                    enabled: "FALSE"
                    effect: {type: ENABLE, target: a, value: true}
                """);

        assertEquals(4, config.rules().get(0).priority());
        assertFalse(config.rules().get(0).enabled());
    }
}
