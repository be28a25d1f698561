package eu.virtualparadox.ctxstore.ticket.graph;

import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the dependency graph of a project's tickets. Dependency ids that resolve to no ticket
 * of the project are dropped from the graph and reported as dangling references.
 */
@Slf4j
@Component
public class DependencyGraphBuilder {

    public DependencyGraph build(final List<TicketEntity> tickets) {
        final Map<String, List<String>> dependencies = new LinkedHashMap<>();
        final Map<String, List<String>> dependents = new LinkedHashMap<>();
        final Map<String, List<String>> dangling = new LinkedHashMap<>();

        for (final TicketEntity t : tickets) {
            dependencies.put(t.getId(), new ArrayList<>());
            dependents.put(t.getId(), new ArrayList<>());
        }

        for (final TicketEntity t : tickets) {
            for (final String dep : t.getDependsOn()) {
                if (!dependencies.containsKey(dep)) {
                    dangling.computeIfAbsent(t.getId(), k -> new ArrayList<>()).add(dep);
                    continue;
                }
                dependencies.get(t.getId()).add(dep);
                dependents.get(dep).add(t.getId());
            }
        }

        if (!dangling.isEmpty()) {
            log.warn("Ignoring dangling ticket dependencies: {}", dangling);
        }

        return new DependencyGraph(freeze(dependencies), freeze(dependents), freeze(dangling));
    }

    private static Map<String, List<String>> freeze(final Map<String, List<String>> map) {
        final Map<String, List<String>> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }
}
