package eu.virtualparadox.ctxstore.ticket.planner;

import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partition of a project's tickets for planning.
 * <p>{@code available} and {@code recommendations} are ordered by priority, then creation order.
 * {@code recommended} is the first recommendation, if any. An in-progress ticket with unfinished
 * dependencies appears in both {@code inProgress} and {@code blocked}; a ticket stored as blocked
 * whose dependencies are all completed is in neither {@code available} nor {@code blocked}.</p>
 */
public record ExecutionPlan(List<TicketEntity> available,
                            List<BlockedTicket> blocked,
                            List<TicketEntity> inProgress,
                            List<TicketEntity> completed,
                            List<TicketEntity> recommendations,
                            Map<String, List<String>> danglingReferences) {

    public Optional<TicketEntity> recommended() {
        return recommendations.isEmpty() ? Optional.empty() : Optional.of(recommendations.get(0));
    }
}
