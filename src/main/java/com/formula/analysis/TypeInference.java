package com.formula.analysis;

import java.util.List;

/**
 * Outcome of type inference: the formula's result type plus non-blocking warnings.
 */
public record TypeInference(ResultType type, List<String> warnings) {

    public TypeInference {
        warnings = List.copyOf(warnings);
    }
}
