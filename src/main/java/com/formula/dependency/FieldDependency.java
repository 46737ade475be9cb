package com.formula.dependency;

/**
 * One field referenced by a formula.
 *
 * @param fieldId   Referenced field id
 * @param known     Whether the field exists in the supplied snapshot
 * @param fieldType Schema type of the field, null when unknown
 */
public record FieldDependency(String fieldId, boolean known, String fieldType) {
}
