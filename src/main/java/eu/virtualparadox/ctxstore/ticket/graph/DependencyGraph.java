package eu.virtualparadox.ctxstore.ticket.graph;

import java.util.List;
import java.util.Map;

/**
 * Adjacency of one project's tickets, rebuilt on every planning read.
 *
 * @param dependencies       ticket id to the ids it depends on, restricted to tickets of the project
 * @param dependents         ticket id to the ids depending on it
 * @param danglingReferences ticket id to stored dependency ids that match no ticket of the project
 */
public record DependencyGraph(Map<String, List<String>> dependencies,
                              Map<String, List<String>> dependents,
                              Map<String, List<String>> danglingReferences) {

    public List<String> dependenciesOf(final String ticketId) {
        return dependencies.getOrDefault(ticketId, List.of());
    }

    public List<String> dependentsOf(final String ticketId) {
        return dependents.getOrDefault(ticketId, List.of());
    }

    public boolean hasDanglingReferences() {
        return !danglingReferences.isEmpty();
    }
}
