package eu.virtualparadox.ctxstore.ticket.model;

import java.util.List;

/**
 * @param deleted             whether the ticket was removed
 * @param dependentsRewritten ids of the tickets whose dependency list dropped the removed id
 */
public record DeleteTicketResult(boolean deleted, List<String> dependentsRewritten) {
}
