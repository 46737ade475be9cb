package com.formula.effect;

import java.util.Objects;

/**
 * Instruction produced when a run-time rule fires. Applying it is the caller's job.
 *
 * @param controlType   Kind of change
 * @param targetFieldId Field to change
 * @param value         New value; a Boolean for VISIBILITY and ENABLE
 */
public record ControlEffect(ControlType controlType, String targetFieldId, Object value) {

    public ControlEffect {
        Objects.requireNonNull(controlType, "controlType cannot be null");
        Objects.requireNonNull(targetFieldId, "targetFieldId cannot be null");
        if (targetFieldId.isBlank()) {
            throw new IllegalArgumentException("targetFieldId cannot be blank");
        }
        if (controlType.requiresBoolean() && !(value instanceof Boolean)) {
            throw new IllegalArgumentException(controlType + " effect on '" + targetFieldId
                    + "' requires a boolean value, got " + value);
        }
    }

    public static ControlEffect visibility(String targetFieldId, boolean visible) {
        return new ControlEffect(ControlType.VISIBILITY, targetFieldId, visible);
    }

    public static ControlEffect enable(String targetFieldId, boolean enabled) {
        return new ControlEffect(ControlType.ENABLE, targetFieldId, enabled);
    }

    public static ControlEffect valueSet(String targetFieldId, Object value) {
        return new ControlEffect(ControlType.VALUE_SET, targetFieldId, value);
    }
}
