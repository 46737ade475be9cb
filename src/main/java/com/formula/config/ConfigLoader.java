package com.formula.config;

import com.formula.effect.ControlEffect;
import com.formula.effect.ControlType;
import com.formula.effect.RuntimeControlRule;
import com.formula.exception.ConfigurationException;
import com.formula.exception.FormulaSyntaxException;
import com.formula.expression.FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads run-time control rule sets from YAML files.
 * <p>
 * Every rule is checked while loading, conditions included, so a broken file fails at
 * startup instead of at the first evaluation.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load a rule set from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rule set file
     * @return Loaded rule set
     * @throws ConfigurationException if the file is missing or malformed
     */
    public static RuleSetConfig load(String path) {
        log.info("Loading control rules from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load control rules from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static RuleSetConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Rule set file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Rule set file must contain a mapping at the top level");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // The rule set may sit at the root or under a 'rule-set' key
        Object section = root.containsKey("rule-set") ? root.get("rule-set") : root;
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'rule-set' must be a mapping");
        }
        Map<String, Object> ruleSet = (Map<String, Object>) section;

        String name = getString(ruleSet, "name", "default");
        String version = getString(ruleSet, "version", "1.0");

        Object rulesObj = ruleSet.get("rules");
        if (rulesObj != null && !(rulesObj instanceof List)) {
            throw new ConfigurationException("'rules' must be a list");
        }
        List<Object> rulesList = rulesObj == null ? List.of() : (List<Object>) rulesObj;
        if (rulesList.isEmpty()) {
            log.warn("Rule set '{}' defines no rules", name);
        }

        List<RuntimeControlRule> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < rulesList.size(); i++) {
            Object item = rulesList.get(i);
            if (!(item instanceof Map)) {
                throw new ConfigurationException("Rule at index " + i + " must be a mapping");
            }
            RuntimeControlRule rule = parseRule((Map<String, Object>) item, i);
            if (!ids.add(rule.id())) {
                throw new ConfigurationException("Duplicate rule id '" + rule.id() + "'");
            }
            rules.add(rule);
            log.debug("Parsed rule: id={}, priority={}, enabled={}, effect={}",
                    rule.id(), rule.priority(), rule.enabled(), rule.effect().controlType());
        }

        RuleSetConfig config = new RuleSetConfig(name, version, rules);
        log.info("Loaded rule set: {} v{} with {} rules ({} enabled)",
                name, version, rules.size(), config.enabledRules().size());
        return config;
    }

    @SuppressWarnings("unchecked")
    private static RuntimeControlRule parseRule(Map<String, Object> map, int index) {
        String id = getString(map, "id", null);
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Rule at index " + index + " has no id");
        }

        String condition = getString(map, "condition", null);
        if (condition == null || condition.isBlank()) {
            throw new ConfigurationException("Rule '" + id + "' has no condition");
        }
        try {
            FormulaParser.parse(condition);
        } catch (FormulaSyntaxException e) {
            throw new ConfigurationException("Rule '" + id + "' has an invalid condition: " + e.getMessage(), e);
        }

        Object effectObj = map.get("effect");
        if (!(effectObj instanceof Map)) {
            throw new ConfigurationException("Rule '" + id + "' has no effect");
        }
        ControlEffect effect = parseEffect((Map<String, Object>) effectObj, id);

        String nameKey = getString(map, "name-key", "rules." + id);
        String descriptionKey = getString(map, "description-key", null);
        boolean enabled = getBoolean(map, "enabled", true, id);
        int priority = getInt(map, "priority", 0, id);

        try {
            return new RuntimeControlRule(id, nameKey, condition, effect, enabled, priority, descriptionKey);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid rule '" + id + "': " + e.getMessage(), e);
        }
    }

    private static ControlEffect parseEffect(Map<String, Object> map, String ruleId) {
        String target = getString(map, "target", null);
        if (target == null || target.isBlank()) {
            throw new ConfigurationException("Effect of rule '" + ruleId + "' has no target");
        }
        try {
            ControlType type = ControlType.fromString(getString(map, "type", null));
            return new ControlEffect(type, target, map.get("value"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid effect of rule '" + ruleId + "': " + e.getMessage(), e);
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue, String ruleId) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        try {
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigurationException("Rule '" + ruleId + "' has a non-integer " + key + ": " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue, String ruleId) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) return true;
        if (text.equalsIgnoreCase("false")) return false;
        throw new ConfigurationException("Rule '" + ruleId + "' has a non-boolean " + key + ": " + value);
    }
}
