package eu.virtualparadox.ctxstore.ticket.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CycleDetectorTest {

    private final CycleDetector detector = new CycleDetector();

    private static Map<String, List<String>> graph(Object... nodeThenDeps) {
        Map<String, List<String>> g = new LinkedHashMap<>();
        for (int i = 0; i < nodeThenDeps.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> deps = (List<String>) nodeThenDeps[i + 1];
            g.put((String) nodeThenDeps[i], deps);
        }
        return g;
    }

    @Test
    @DisplayName("Acyclic graph yields no cycles")
    void acyclic() {
        Map<String, List<String>> g = graph(
                "A", List.of(),
                "B", List.of("A"),
                "C", List.of("A", "B"));

        assertThat(detector.findCycles(g)).isEmpty();
    }

    @Test
    @DisplayName("Three-node cycle is reported from the repeated node onward")
    void threeNodeCycle() {
        Map<String, List<String>> g = graph(
                "A", List.of("B"),
                "B", List.of("C"),
                "C", List.of("A"));

        assertThat(detector.findCycles(g)).containsExactly(List.of("A", "B", "C", "A"));
    }

    @Test
    @DisplayName("Cycle not containing the DFS root starts at the repeated node")
    void cycleBelowRoot() {
        Map<String, List<String>> g = graph(
                "Root", List.of("X"),
                "X", List.of("Y"),
                "Y", List.of("X"));

        assertThat(detector.findCycles(g)).containsExactly(List.of("X", "Y", "X"));
    }

    @Test
    @DisplayName("All independent cycles are reported")
    void multipleCycles() {
        Map<String, List<String>> g = graph(
                "A", List.of("B"),
                "B", List.of("A"),
                "C", List.of("D"),
                "D", List.of("C"));

        assertThat(detector.findCycles(g))
                .containsExactly(List.of("A", "B", "A"), List.of("C", "D", "C"));
    }

    @Test
    @DisplayName("Diamond shaped sharing is not a cycle")
    void diamond() {
        Map<String, List<String>> g = graph(
                "Top", List.of("Left", "Right"),
                "Left", List.of("Bottom"),
                "Right", List.of("Bottom"),
                "Bottom", List.of());

        assertThat(detector.findCycles(g)).isEmpty();
    }

    @Test
    @DisplayName("Neighbours outside the map are treated as leaves")
    void externalNeighbours() {
        Map<String, List<String>> g = graph("A", List.of("Stored"));
        assertThat(detector.findCycles(g)).isEmpty();
    }

    @Test
    @DisplayName("Deep chains do not overflow the call stack")
    void deepChain() {
        Map<String, List<String>> g = new LinkedHashMap<>();
        int n = 50_000;
        for (int i = 0; i < n; i++) {
            g.put("n" + i, i + 1 < n ? List.of("n" + (i + 1)) : List.of("n0"));
        }

        List<List<String>> cycles = detector.findCycles(g);
        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0)).hasSize(n + 1);
    }
}
