package com.formula.dependency;

import java.util.List;

/**
 * A dependency cycle, rotated so that it starts at its smallest field id.
 *
 * @param fieldIds Participating field ids in dependency order
 */
public record Cycle(List<String> fieldIds) {

    public Cycle {
        if (fieldIds == null || fieldIds.isEmpty()) {
            throw new IllegalArgumentException("fieldIds cannot be empty");
        }
        fieldIds = List.copyOf(fieldIds);
    }

    /**
     * Display path that closes the loop, e.g. {@code a -> b -> a}.
     */
    public String path() {
        return String.join(" -> ", fieldIds) + " -> " + fieldIds.get(0);
    }
}
