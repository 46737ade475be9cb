package com.formula.function;

import com.formula.analysis.ResultType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FunctionRegistry.
 */
class FunctionRegistryTest {

    @Test
    @DisplayName("Registry holds exactly the allow-listed functions, sorted")
    void names() {
        assertEquals(List.of("abs", "coalesce", "concat", "if_else", "is_empty", "lower",
                        "max", "min", "pow", "round", "sum", "upper"),
                List.copyOf(FunctionRegistry.names()));
    }

    @Test
    @DisplayName("Lookup is exact and case-sensitive")
    void lookup() {
        assertTrue(FunctionRegistry.find("round").isPresent());
        assertTrue(FunctionRegistry.find("ROUND").isEmpty());
        assertFalse(FunctionRegistry.isBuiltin("strip"));
    }

    @Test
    @DisplayName("Arity ranges")
    void arity() {
        FunctionDefinition round = FunctionRegistry.find("round").orElseThrow();
        assertTrue(round.acceptsArity(1));
        assertTrue(round.acceptsArity(2));
        assertFalse(round.acceptsArity(3));
        assertEquals("1 to 2", round.describeArity());

        FunctionDefinition min = FunctionRegistry.find("min").orElseThrow();
        assertFalse(min.acceptsArity(0));
        assertTrue(min.acceptsArity(20));
        assertEquals("at least 1", min.describeArity());

        assertEquals("Function 'pow' expects 2 arguments, got 1",
                FunctionRegistry.find("pow").orElseThrow().arityMismatch(1));
    }

    @Test
    @DisplayName("Definitions reject an inverted arity range")
    void invalidDefinition() {
        assertThrows(IllegalArgumentException.class, () -> new FunctionDefinition(
                "broken", 2, 1, ReturnTypeRule.fixed(ResultType.NUMBER), args -> null));
    }
}
