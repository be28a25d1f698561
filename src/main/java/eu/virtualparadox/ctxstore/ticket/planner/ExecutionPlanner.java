package eu.virtualparadox.ctxstore.ticket.planner;

import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.ticket.ETicketStatus;
import eu.virtualparadox.ctxstore.ticket.ETicketType;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.graph.DependencyGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes which tickets can be worked on now.
 * <ul>
 *   <li>a ticket that is not completed is blocked while any of its dependencies is not completed,
 *       whatever its stored status</li>
 *   <li>a pending ticket whose dependencies are all completed is available</li>
 *   <li>{@code inProgress} and {@code completed} list tickets by stored status</li>
 * </ul>
 * Available tickets are ordered by priority ({@code critical} first), then by ascending creation order.
 */
@Component
public class ExecutionPlanner {

    static final Comparator<TicketEntity> PRIORITY_ORDER =
            Comparator.comparingInt((TicketEntity t) -> t.getPriority().rank())
                    .thenComparingInt(TicketEntity::getOrderIndex);

    public ExecutionPlan plan(final List<TicketEntity> tickets,
                              final DependencyGraph graph,
                              final PlanOptions options) {
        if (options.limit() < 1) {
            throw new ValidationException("limit must be at least 1", Map.of("limit", options.limit()));
        }

        final Map<String, TicketEntity> byId = new HashMap<>();
        tickets.forEach(t -> byId.put(t.getId(), t));

        final List<TicketEntity> available = new ArrayList<>();
        final List<BlockedTicket> blocked = new ArrayList<>();
        final List<TicketEntity> inProgress = new ArrayList<>();
        final List<TicketEntity> completed = new ArrayList<>();

        for (final TicketEntity t : tickets) {
            if (t.getStatus() == ETicketStatus.COMPLETED) {
                completed.add(t);
                continue;
            }
            if (t.getStatus() == ETicketStatus.IN_PROGRESS) {
                inProgress.add(t);
            }

            final List<String> unfinished = graph.dependenciesOf(t.getId()).stream()
                    .filter(dep -> byId.get(dep).getStatus() != ETicketStatus.COMPLETED)
                    .toList();

            if (!unfinished.isEmpty()) {
                blocked.add(new BlockedTicket(t, unfinished));
            } else if (t.getStatus() == ETicketStatus.PENDING) {
                available.add(t);
            }
        }

        available.sort(PRIORITY_ORDER);
        blocked.sort(Comparator.comparing(BlockedTicket::ticket, PRIORITY_ORDER));

        final List<TicketEntity> recommendations = available.stream()
                .filter(t -> options.includeTesting() || t.getType() != ETicketType.TESTING)
                .limit(options.limit())
                .toList();

        return new ExecutionPlan(available, blocked, inProgress, completed, recommendations,
                graph.danglingReferences());
    }
}
