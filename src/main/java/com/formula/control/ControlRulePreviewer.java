package com.formula.control;

import com.formula.analysis.FieldInfo;
import com.formula.core.Values;
import com.formula.engine.FormulaEngine;
import com.formula.execution.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dry-runs control rules against sample values. Purely in-memory: nothing is stored
 * and neither the snapshot nor the values are modified.
 */
public class ControlRulePreviewer {

    private static final Logger log = LoggerFactory.getLogger(ControlRulePreviewer.class);

    private final ControlRuleValidator validator;
    private final FormulaEngine engine;

    public ControlRulePreviewer(ControlRuleValidator validator, FormulaEngine engine) {
        this.validator = Objects.requireNonNull(validator, "validator cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    /**
     * Validate a rule and, when ALLOWED, execute it.
     *
     * @param ruleInput   Submitted rule
     * @param fields      Schema field snapshot
     * @param fieldValues Sample values keyed by field id
     * @return Preview outcome; BLOCKED and CLEARED rules are not executed
     * @throws IllegalArgumentException if the rule type is unknown
     */
    public PreviewResult preview(PreviewInput ruleInput, Collection<FieldInfo> fields, Map<String, ?> fieldValues) {
        Objects.requireNonNull(fieldValues, "fieldValues cannot be null");
        ControlRule rule = ControlRule.from(ruleInput);

        ControlRuleResult verdict = validator.validateControlRule(
                rule.ruleType(), rule.targetFieldId(), rule.formulaText(), fields, null);
        if (!verdict.isAllowed()) {
            return new PreviewResult(ruleInput, verdict.status(), verdict.blockReason(), null, null);
        }

        ExecutionResult execution = engine.execute(rule.formulaText(), fieldValues);
        if (!execution.success()) {
            log.debug("Preview of {} rule on '{}' failed: {}",
                    rule.ruleType(), rule.targetFieldId(), execution.error());
            return new PreviewResult(ruleInput, ControlRuleStatus.ALLOWED, null, null, execution.error());
        }
        return new PreviewResult(ruleInput, ControlRuleStatus.ALLOWED, null, toBoolean(execution.value()), null);
    }

    /**
     * Preview several rules at once and fold them into per-field states.
     *
     * @return One state per snapshot field, in snapshot order
     */
    public List<FieldPreviewState> previewFieldStates(List<PreviewInput> ruleInputs, Collection<FieldInfo> fields,
                                                      Map<String, ?> fieldValues) {
        Map<String, StateBuilder> states = new LinkedHashMap<>();
        for (FieldInfo field : fields) {
            states.putIfAbsent(field.fieldId(), new StateBuilder(field.fieldId()));
        }

        for (PreviewInput input : ruleInputs) {
            StateBuilder state = states.get(input.targetFieldId());
            if (state == null) {
                log.warn("Skipping {} rule: target field '{}' is not in the schema",
                        input.ruleType(), input.targetFieldId());
                continue;
            }
            PreviewResult result = preview(input, fields, fieldValues);
            ControlRuleType type = ControlRuleType.fromString(input.ruleType());
            if (result.validationStatus() == ControlRuleStatus.BLOCKED) {
                state.blocked.put(type, result.blockReason());
            } else if (result.executionError() != null) {
                state.failed.put(type, result.executionError());
            } else if (result.executed()) {
                state.apply(type, result.executionResult());
            }
        }

        List<FieldPreviewState> previews = new ArrayList<>();
        for (StateBuilder state : states.values()) {
            previews.add(state.build());
        }
        return previews;
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return Values.isTruthy(value);
    }

    private static final class StateBuilder {

        private final String fieldId;
        private boolean visible = true;
        private boolean enabled = true;
        private boolean required = false;
        private final List<ControlRuleType> applied = new ArrayList<>();
        private final Map<ControlRuleType, String> blocked = new EnumMap<>(ControlRuleType.class);
        private final Map<ControlRuleType, String> failed = new EnumMap<>(ControlRuleType.class);

        private StateBuilder(String fieldId) {
            this.fieldId = fieldId;
        }

        private void apply(ControlRuleType type, boolean value) {
            switch (type) {
                case VISIBILITY -> visible = value;
                case ENABLED -> enabled = value;
                case REQUIRED -> required = value;
            }
            applied.add(type);
        }

        private FieldPreviewState build() {
            return new FieldPreviewState(fieldId, visible, enabled, required, applied, blocked, failed);
        }
    }
}
