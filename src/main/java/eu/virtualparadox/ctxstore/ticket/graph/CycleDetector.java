package eu.virtualparadox.ctxstore.ticket.graph;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds dependency cycles with an iterative depth-first search.
 * <p>Nodes are visited in map order. A single mutable path mirrors the explicit stack; an edge into
 * a node that is still on the path closes a cycle, reported as the path from that node onward with
 * the node repeated at the end. Every cycle closed during the traversal is reported.</p>
 */
@Component
public class CycleDetector {

    private static final int UNVISITED = 0;
    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    /**
     * @param adjacency node to the nodes it depends on; neighbours that are not keys have no outgoing edges
     * @return detected cycles, empty if the graph is acyclic
     */
    public List<List<String>> findCycles(final Map<String, List<String>> adjacency) {
        final Map<String, Integer> state = new HashMap<>();
        final List<List<String>> cycles = new ArrayList<>();

        for (final String root : adjacency.keySet()) {
            if (state.getOrDefault(root, UNVISITED) != UNVISITED) {
                continue;
            }

            final Deque<Frame> stack = new ArrayDeque<>();
            final List<String> path = new ArrayList<>();
            stack.push(new Frame(root));
            path.add(root);
            state.put(root, ON_PATH);

            while (!stack.isEmpty()) {
                final Frame top = stack.peek();
                final List<String> neighbours = adjacency.getOrDefault(top.node, List.of());

                if (top.next < neighbours.size()) {
                    final String next = neighbours.get(top.next++);
                    final int s = state.getOrDefault(next, UNVISITED);
                    if (s == ON_PATH) {
                        final List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                        cycle.add(next);
                        cycles.add(List.copyOf(cycle));
                    } else if (s == UNVISITED) {
                        state.put(next, ON_PATH);
                        stack.push(new Frame(next));
                        path.add(next);
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    state.put(top.node, DONE);
                }
            }
        }
        return cycles;
    }

    private static final class Frame {
        private final String node;
        private int next;

        private Frame(final String node) {
            this.node = node;
        }
    }
}
