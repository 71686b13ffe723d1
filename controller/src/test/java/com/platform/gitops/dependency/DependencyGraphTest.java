package com.platform.gitops.dependency;

import com.platform.gitops.model.UnitKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static final UnitKey A = UnitKey.of("ns", "a");
    private static final UnitKey B = UnitKey.of("ns", "b");
    private static final UnitKey C = UnitKey.of("ns", "c");
    private static final UnitKey D = UnitKey.of("ns", "d");

    private static Map<UnitKey, List<UnitKey>> edges(Object... pairs) {
        Map<UnitKey, List<UnitKey>> edges = new TreeMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<UnitKey> deps = (List<UnitKey>) pairs[i + 1];
            edges.put((UnitKey) pairs[i], deps);
        }
        return edges;
    }

    @Test
    void acyclicGraphHasNoCycles() {
        assertTrue(DependencyGraph.detectCycles(edges(A, List.of(B, C), B, List.of(C), C, List.of())).isEmpty());
    }

    @Test
    @DisplayName("Every unit on a cycle gets a closed path starting at itself")
    void cycleMembers() {
        Map<UnitKey, List<UnitKey>> cycles = DependencyGraph.detectCycles(
            edges(A, List.of(B), B, List.of(C), C, List.of(A), D, List.of(A)));

        assertEquals(List.of(A, B, C, A), cycles.get(A));
        assertEquals(List.of(B, C, A, B), cycles.get(B));
        assertEquals(List.of(C, A, B, C), cycles.get(C));
        assertFalse(cycles.containsKey(D));
    }

    @Test
    void selfDependencyIsACycle() {
        assertEquals(List.of(A, A), DependencyGraph.detectCycles(edges(A, List.of(A))).get(A));
    }

    @Test
    void edgesToUnknownUnitsAreIgnored() {
        UnitKey missing = UnitKey.of("ns", "missing");

        assertTrue(DependencyGraph.detectCycles(edges(A, List.of(missing))).isEmpty());
    }

    @Test
    @DisplayName("A unit whose only way back runs through an already explored node is still on the cycle")
    void cycleThroughExploredNode() {
        Map<UnitKey, List<UnitKey>> cycles = DependencyGraph.detectCycles(
            edges(A, List.of(B), B, List.of(C, D), C, List.of(A), D, List.of(C)));

        assertEquals(4, cycles.size());
        assertEquals(List.of(D, C, A, B, D), cycles.get(D));
        assertEquals(List.of(A, B, C, A), cycles.get(A));
    }

    @Test
    void twoSeparateCycles() {
        Map<UnitKey, List<UnitKey>> cycles = DependencyGraph.detectCycles(
            edges(A, List.of(B), B, List.of(A), C, List.of(D), D, List.of(C, A)));

        assertEquals(List.of(A, B, A), cycles.get(A));
        assertEquals(List.of(D, C, D), cycles.get(D));
    }
}
