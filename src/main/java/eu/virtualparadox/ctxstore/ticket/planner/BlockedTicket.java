package eu.virtualparadox.ctxstore.ticket.planner;

import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;

import java.util.List;

/**
 * A blocked ticket with the ids of its dependencies that are not completed yet, never empty.
 */
public record BlockedTicket(TicketEntity ticket, List<String> unfinishedDependencies) {
}
