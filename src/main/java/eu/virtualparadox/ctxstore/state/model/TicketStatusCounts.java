package eu.virtualparadox.ctxstore.state.model;

import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;

import java.util.List;

/**
 * Ticket totals per stored status.
 */
public record TicketStatusCounts(int total, int pending, int inProgress, int completed, int blocked) {

    public static TicketStatusCounts of(final List<TicketEntity> tickets) {
        int pending = 0, inProgress = 0, completed = 0, blocked = 0;
        for (final TicketEntity t : tickets) {
            switch (t.getStatus()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case BLOCKED -> blocked++;
            }
        }
        return new TicketStatusCounts(tickets.size(), pending, inProgress, completed, blocked);
    }

    /**
     * @return share of completed tickets as a whole percentage, 0 for a project without tickets
     */
    public int progress() {
        if (total == 0) {
            return 0;
        }
        return (int) Math.round(completed * 100.0 / total);
    }
}
