package io.github.manjago.v8decomp.simplify;

import io.github.manjago.v8decomp.core.FunctionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScopeGraph.
 */
class ScopeGraphTest {

    private static FunctionRecord function(String scope, String outer) {
        FunctionRecord f = new FunctionRecord(null);
        f.setScopeInfoAddress(scope);
        f.setOuterScopeInfoAddress(outer);
        return f;
    }

    @Test
    @DisplayName("Ids follow numeric address order")
    void testIdsByAddress() {
        ScopeGraph graph = ScopeGraph.build(List.of(
                function("0x100", "0x20"),
                function("0x20", null),
                function("0x3000", "0x100")));

        assertEquals(1, graph.idOf("0x20"));
        assertEquals(2, graph.idOf("0x100"));
        assertEquals(3, graph.idOf("0x3000"));
        assertEquals(List.of("0x20", "0x100", "0x3000"), List.copyOf(graph.ids().keySet()));
        assertEquals(3, graph.size());
    }

    @Test
    @DisplayName("Unknown address gets the next id and keeps it")
    void testUnknownAddress() {
        ScopeGraph graph = ScopeGraph.build(List.of(function("0x100", null)));

        assertEquals(2, graph.idOf("0x999"));
        assertEquals(2, graph.idOf("0x999"));
        assertEquals(1, graph.idOf("0x100"));
    }

    @Test
    @DisplayName("Outer-only addresses are numbered too")
    void testOuterOnly() {
        ScopeGraph graph = ScopeGraph.build(List.of(function("0x200", "0x100")));

        assertEquals(1, graph.idOf("0x100"));
        assertEquals("0x100", graph.parentOf("0x200"));
        assertNull(graph.parentOf("0x100"));
    }

    @Test
    @DisplayName("Ascend walks outer scopes")
    void testAscend() {
        ScopeGraph graph = ScopeGraph.build(List.of(
                function("0x300", "0x200"),
                function("0x200", "0x100"),
                function("0x100", null)));

        assertEquals("0x300", graph.ascend("0x300", 0));
        assertEquals("0x200", graph.ascend("0x300", 1));
        assertEquals("0x100", graph.ascend("0x300", 2));
        assertNull(graph.ascend("0x300", 3));
        assertNull(graph.ascend("0x300", 4));
        assertNull(graph.ascend(null, 1));
    }

    @Test
    @DisplayName("Depth counts the outer scope and its ancestors")
    void testDepthOfOuter() {
        ScopeGraph graph = ScopeGraph.build(List.of(
                function("0x300", "0x200"),
                function("0x200", "0x100"),
                function("0x100", null)));

        assertEquals(0, graph.depthOfOuter(null));
        assertEquals(1, graph.depthOfOuter("0x100"));
        assertEquals(2, graph.depthOfOuter("0x200"));
        assertEquals(3, graph.depthOfOuter("0x300"));
    }

    @Test
    @DisplayName("Cyclic outer chain terminates")
    void testCycle() {
        ScopeGraph graph = ScopeGraph.build(List.of(
                function("0x1", "0x2"),
                function("0x2", "0x1")));

        assertEquals(2, graph.depthOfOuter("0x1"));
    }

    @Test
    @DisplayName("Empty graph")
    void testEmpty() {
        ScopeGraph graph = ScopeGraph.empty();

        assertEquals(0, graph.size());
        assertTrue(graph.ids().isEmpty());
        assertEquals(1, graph.idOf("0x10"));
    }
}
