package com.formula.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the formula engine.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    /**
     * Whether the formula engine beans are registered.
     */
    private boolean enabled = true;

    /**
     * Path to the run-time control rule set.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesPath = "classpath:control-rules.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }
}
