package com.formula.analysis;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only snapshot of one schema field, supplied per call and never retained.
 *
 * @param fieldId   Field id as referenced from formulas
 * @param fieldType Schema field type (TEXT, NUMBER, CHECKBOX, ...)
 * @param label     Display label
 */
public record FieldInfo(String fieldId, String fieldType, String label) {

    public FieldInfo {
        Objects.requireNonNull(fieldId, "fieldId cannot be null");
        Objects.requireNonNull(fieldType, "fieldType cannot be null");
        if (label == null) {
            label = fieldId;
        }
    }

    public static FieldInfo of(String fieldId, String fieldType) {
        return new FieldInfo(fieldId, fieldType, fieldId);
    }

    public ResultType resultType() {
        return ResultType.fromFieldType(fieldType);
    }

    /**
     * Key a snapshot by field id. A later duplicate id replaces an earlier one.
     */
    public static Map<String, FieldInfo> index(Collection<FieldInfo> fields) {
        Map<String, FieldInfo> byId = new LinkedHashMap<>();
        for (FieldInfo field : fields) {
            byId.put(field.fieldId(), field);
        }
        return byId;
    }
}
