package com.formula.adapter.spring;

import com.formula.config.ConfigLoader;
import com.formula.config.RuleSetConfig;
import com.formula.control.ControlRulePreviewer;
import com.formula.control.ControlRuleValidator;
import com.formula.control.ControlStateEvaluator;
import com.formula.effect.ControlEffectEvaluator;
import com.formula.engine.DefaultFormulaEngine;
import com.formula.engine.FormulaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the formula engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "formula", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FormulaAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public FormulaEngine formulaEngine() {
        return new DefaultFormulaEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleSetConfig ruleSetConfig(FormulaProperties properties) {
        log.debug("Creating RuleSetConfig bean (formula.rules-path={})", properties.getRulesPath());
        return ConfigLoader.load(properties.getRulesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ControlRuleValidator controlRuleValidator(FormulaEngine engine) {
        return new ControlRuleValidator(engine);
    }

    @Bean
    @ConditionalOnMissingBean
    public ControlRulePreviewer controlRulePreviewer(ControlRuleValidator validator, FormulaEngine engine) {
        return new ControlRulePreviewer(validator, engine);
    }

    @Bean
    @ConditionalOnMissingBean
    public ControlStateEvaluator controlStateEvaluator(FormulaEngine engine) {
        return new ControlStateEvaluator(engine);
    }

    @Bean
    @ConditionalOnMissingBean
    public ControlEffectEvaluator controlEffectEvaluator(FormulaEngine engine) {
        return new ControlEffectEvaluator(engine);
    }
}
