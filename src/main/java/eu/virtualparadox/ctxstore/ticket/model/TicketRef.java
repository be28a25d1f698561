package eu.virtualparadox.ctxstore.ticket.model;

/**
 * Identifies a ticket within a project, by id or by title.
 */
public record TicketRef(String id, String title) {

    public static TicketRef byId(final String id) {
        return new TicketRef(id, null);
    }

    public static TicketRef byTitle(final String title) {
        return new TicketRef(null, title);
    }

    @Override
    public String toString() {
        return id != null ? id : title;
    }
}
