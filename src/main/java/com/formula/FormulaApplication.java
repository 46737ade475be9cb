package com.formula;

import com.formula.analysis.FieldInfo;
import com.formula.config.RuleSetConfig;
import com.formula.control.ControlRulePreviewer;
import com.formula.control.ControlRuleResult;
import com.formula.control.ControlRuleType;
import com.formula.control.ControlRuleValidator;
import com.formula.control.PreviewInput;
import com.formula.control.PreviewResult;
import com.formula.core.FieldValuesFactory;
import com.formula.effect.ControlEffect;
import com.formula.effect.ControlEffectEvaluator;
import com.formula.effect.EvaluationResult;
import com.formula.spring.EnableFormulaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating formula engine usage.
 */
@SpringBootApplication
@EnableFormulaEngine
public class FormulaApplication {

    private static final Logger log = LoggerFactory.getLogger(FormulaApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FormulaApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ControlRuleValidator validator,
                                  ControlRulePreviewer previewer,
                                  ControlEffectEvaluator effectEvaluator,
                                  RuleSetConfig ruleSet) {
        return args -> {
            log.info("=== Formula Demo Started ===");

            List<FieldInfo> schema = List.of(
                    FieldInfo.of("quantity", "NUMBER"),
                    FieldInfo.of("unit_price", "NUMBER"),
                    FieldInfo.of("is_active", "CHECKBOX"),
                    FieldInfo.of("discount", "NUMBER"),
                    FieldInfo.of("notes", "TEXTAREA")
            );

            // Design time: which formulas may become control rules
            for (String formula : List.of("is_active and quantity > 0", "quantity * unit_price", "missing > 1")) {
                ControlRuleResult result = validator.validateControlRule(
                        ControlRuleType.VISIBILITY, "discount", formula, schema, null);
                log.info("VISIBILITY '{}' -> {} {}", formula, result.status(), result.getBlockReason().orElse(""));
            }

            String json = """
                {
                    "quantity": 12,
                    "unit_price": 12.5,
                    "is_active": true,
                    "discount": 0,
                    "notes": ""
                }
                """;
            Map<String, Object> values = FieldValuesFactory.fromJson(json);

            PreviewResult preview = previewer.preview(
                    new PreviewInput("ENABLED", "discount", "quantity >= 10"), schema, values);
            log.info("Preview: status={}, result={}", preview.validationStatus(), preview.executionResult());

            // Run time: rule set from configuration
            EvaluationResult evaluation = effectEvaluator.evaluateRules(ruleSet.rules(), values);
            for (ControlEffect effect : effectEvaluator.resolveConflicts(evaluation.effects())) {
                log.info("Effect: {} {} = {}", effect.controlType(), effect.targetFieldId(), effect.value());
            }
            for (String error : evaluation.errors()) {
                log.warn("Rule error: {}", error);
            }

            log.info("=== Formula Demo Completed ===");
        };
    }
}
