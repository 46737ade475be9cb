package com.formula.dependency;

import com.formula.analysis.FieldInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DependencyAnalyzer.
 */
class DependencyAnalyzerTest {

    private DependencyAnalyzer analyzer;
    private List<FieldInfo> fields;

    @BeforeEach
    void setUp() {
        analyzer = new DependencyAnalyzer();
        fields = List.of(
                FieldInfo.of("quantity", "NUMBER"),
                FieldInfo.of("unit_price", "NUMBER")
        );
    }

    @Test
    @DisplayName("References are sorted and exclude function names")
    void fieldReferences() {
        SortedSet<String> refs = analyzer.fieldReferences("round(unit_price * quantity, 2) + sum(quantity)");

        assertEquals(List.of("quantity", "unit_price"), List.copyOf(refs));
    }

    @Test
    @DisplayName("Unparseable formula has no references")
    void unparseable() {
        assertTrue(analyzer.fieldReferences("quantity *").isEmpty());
        assertTrue(analyzer.fieldReferences("  ").isEmpty());
    }

    @Test
    @DisplayName("Analysis classifies known and unknown references")
    void analyze() {
        DependencyResult result = analyzer.analyze("quantity * discount", fields);

        assertEquals(List.of("discount", "quantity"), List.copyOf(result.fieldReferences()));
        assertEquals(List.of(
                new FieldDependency("discount", false, null),
                new FieldDependency("quantity", true, "NUMBER")
        ), result.dependencies());
        assertEquals(Set.of("discount"), result.unknownFields());
        assertTrue(result.getParseError().isEmpty());
    }

    @Test
    @DisplayName("Parse failure is reported instead of references")
    void analyzeParseFailure() {
        DependencyResult result = analyzer.analyze("quantity *", fields);

        assertEquals("Syntax error: Unexpected end of formula at position 10", result.parseError());
        assertTrue(result.fieldReferences().isEmpty());
    }

    @Test
    @DisplayName("Dependency map feeds the cycle detector")
    void dependencyMap() {
        Map<String, SortedSet<String>> map = analyzer.dependencyMap(Map.of(
                "total", "subtotal * 1.2",
                "subtotal", "total - tax",
                "tax", "broken +"
        ));

        assertEquals(Set.of("subtotal"), map.get("total"));
        assertEquals(Set.of("tax", "total"), map.get("subtotal"));
        assertTrue(map.get("tax").isEmpty());

        CycleResult cycles = new CycleDetector().detect(map);
        assertEquals(List.of("subtotal", "total"), cycles.cycleMembers());
    }
}
