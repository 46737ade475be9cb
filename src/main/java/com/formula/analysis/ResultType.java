package com.formula.analysis;

import java.util.Locale;
import java.util.Map;

/**
 * Inferred result type of a formula.
 */
public enum ResultType {
    NUMBER,
    TEXT,
    BOOLEAN,
    UNKNOWN;

    /**
     * Schema field types mapped to the result type a bare reference to such a field yields.
     * Types not listed here (CALCULATED, LOOKUP, TABLE, ...) infer as UNKNOWN.
     */
    private static final Map<String, ResultType> FIELD_TYPES = Map.ofEntries(
            Map.entry("TEXT", TEXT),
            Map.entry("TEXTAREA", TEXT),
            Map.entry("DATE", TEXT),
            Map.entry("DROPDOWN", TEXT),
            Map.entry("RADIO", TEXT),
            Map.entry("FILE", TEXT),
            Map.entry("IMAGE", TEXT),
            Map.entry("NUMBER", NUMBER),
            Map.entry("CHECKBOX", BOOLEAN),
            Map.entry("BOOLEAN", BOOLEAN)
    );

    /**
     * Map a schema field type to a result type.
     *
     * @param fieldType Field type as stored in the schema (case-insensitive), may be null
     * @return Mapped result type, UNKNOWN when unmapped
     */
    public static ResultType fromFieldType(String fieldType) {
        if (fieldType == null) {
            return UNKNOWN;
        }
        return FIELD_TYPES.getOrDefault(fieldType.trim().toUpperCase(Locale.ROOT), UNKNOWN);
    }
}
