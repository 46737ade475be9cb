package com.formula.config;

import com.formula.effect.RuntimeControlRule;

import java.util.List;
import java.util.Optional;

/**
 * Named set of run-time control rules loaded from configuration.
 *
 * @param name    Rule set name
 * @param version Rule set version
 * @param rules   Rules in file order
 */
public record RuleSetConfig(String name, String version, List<RuntimeControlRule> rules) {

    public RuleSetConfig {
        rules = List.copyOf(rules);
    }

    public Optional<RuntimeControlRule> getRule(String id) {
        return rules.stream().filter(rule -> rule.id().equals(id)).findFirst();
    }

    public List<RuntimeControlRule> enabledRules() {
        return rules.stream().filter(RuntimeControlRule::enabled).toList();
    }
}
