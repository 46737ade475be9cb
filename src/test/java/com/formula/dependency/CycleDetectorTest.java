package com.formula.dependency;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CycleDetector.
 */
class CycleDetectorTest {

    private CycleDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CycleDetector();
    }

    @Test
    @DisplayName("Acyclic graph has no cycle")
    void acyclic() {
        CycleResult result = detector.detect(Map.of(
                "total", List.of("subtotal", "tax"),
                "tax", List.of("subtotal"),
                "subtotal", List.of("quantity", "price")
        ));

        assertFalse(result.hasCycle());
        assertTrue(result.cycleMembers().isEmpty());
        assertEquals(3, result.analyzedFieldCount());
    }

    @Test
    @DisplayName("Two-field cycle is reported from its smallest id")
    void twoFieldCycle() {
        CycleResult result = detector.detect(Map.of(
                "b", List.of("a"),
                "a", List.of("b")
        ));

        assertTrue(result.hasCycle());
        assertEquals(List.of("a", "b"), result.cycleMembers());
        assertEquals(1, result.cycles().size());
        assertEquals("a -> b -> a", result.cycles().get(0).path());
    }

    @Test
    @DisplayName("Self reference is a cycle")
    void selfReference() {
        CycleResult result = detector.detect(Map.of("a", Set.of("a")));

        assertTrue(result.hasCycle());
        assertEquals(List.of("a"), result.cycleMembers());
        assertEquals("a -> a", result.cycles().get(0).path());
    }

    @Test
    @DisplayName("Longer cycle keeps dependency order")
    void longerCycle() {
        CycleResult result = detector.detect(Map.of(
                "c", List.of("a"),
                "a", List.of("b"),
                "b", List.of("c"),
                "d", List.of("a")
        ));

        assertEquals(List.of("a", "b", "c"), result.cycleMembers());
        assertEquals("a -> b -> c -> a", result.cycles().get(0).path());
    }

    @Test
    @DisplayName("Distinct cycles are all reported, ordered by path")
    void multipleCycles() {
        CycleResult result = detector.detect(Map.of(
                "x", List.of("y"),
                "y", List.of("x"),
                "a", List.of("b"),
                "b", List.of("a")
        ));

        assertEquals(2, result.cycles().size());
        assertEquals("a -> b -> a", result.cycles().get(0).path());
        assertEquals("x -> y -> x", result.cycles().get(1).path());
        assertEquals(List.of("a", "b"), result.cycleMembers());
    }

    @Test
    @DisplayName("Result does not depend on map iteration order")
    void orderIndependent() {
        Map<String, List<String>> forward = new LinkedHashMap<>();
        forward.put("a", List.of("b"));
        forward.put("b", List.of("c"));
        forward.put("c", List.of("a"));

        Map<String, List<String>> backward = new LinkedHashMap<>();
        backward.put("c", List.of("a"));
        backward.put("b", List.of("c"));
        backward.put("a", List.of("b"));

        assertEquals(detector.detect(forward), detector.detect(backward));
    }

    @Test
    @DisplayName("Dependencies on fields outside the map are leaves")
    void externalDependencies() {
        CycleResult result = detector.detect(Map.of("a", List.of("quantity", "price")));

        assertFalse(result.hasCycle());
        assertEquals(1, result.analyzedFieldCount());
    }

    @Test
    @DisplayName("Null dependency list is treated as empty")
    void nullDependencies() {
        Map<String, List<String>> map = new HashMap<>();
        map.put("a", null);

        assertFalse(detector.detect(map).hasCycle());
    }

    @Test
    @DisplayName("Input map is not modified")
    void inputUntouched() {
        Map<String, List<String>> map = new HashMap<>();
        map.put("a", List.of("b"));
        map.put("b", List.of("a"));
        Map<String, List<String>> copy = new HashMap<>(map);

        detector.detect(map);

        assertEquals(copy, map);
    }

    @Test
    @DisplayName("Null map is a programmer error")
    void nullMap() {
        assertThrows(NullPointerException.class, () -> detector.detect(null));
    }

    @Test
    @DisplayName("Very long dependency chain is searched without exhausting the stack")
    void longChain() {
        int length = 50_000;
        Map<String, List<String>> chain = new HashMap<>();
        for (int i = 0; i < length; i++) {
            chain.put(String.format("f%05d", i), List.of(String.format("f%05d", (i + 1) % length)));
        }

        CycleResult result = detector.detect(chain);

        assertTrue(result.hasCycle());
        assertEquals(1, result.cycles().size());
        assertEquals(length, result.cycleMembers().size());
        assertEquals("f00000", result.cycleMembers().get(0));
        assertEquals("f00001", result.cycleMembers().get(1));
    }

    @Test
    @DisplayName("Very long acyclic chain has no cycle")
    void longAcyclicChain() {
        int length = 50_000;
        Map<String, List<String>> chain = new HashMap<>();
        for (int i = 0; i < length - 1; i++) {
            chain.put("f" + i, List.of("f" + (i + 1)));
        }
        chain.put("f" + (length - 1), List.of());

        CycleResult result = detector.detect(chain);

        assertFalse(result.hasCycle());
        assertEquals(length, result.analyzedFieldCount());
    }
}
