package eu.virtualparadox.ctxstore.exception;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ticket dependencies would form one or more cycles. Each cycle is a list of ticket titles,
 * starting and ending with the repeated ticket.
 */
public class DependencyCycleException extends ContextStoreException {

    private final List<List<String>> cycles;

    public DependencyCycleException(final List<List<String>> cycles) {
        super(EErrorCode.DEPENDENCY_CYCLE, "Circular dependencies detected: " + describe(cycles),
                Map.of("cycles", cycles));
        this.cycles = List.copyOf(cycles);
    }

    public List<List<String>> getCycles() {
        return cycles;
    }

    private static String describe(final List<List<String>> cycles) {
        return cycles.stream()
                .map(c -> String.join(" -> ", c))
                .collect(Collectors.joining("; "));
    }
}
