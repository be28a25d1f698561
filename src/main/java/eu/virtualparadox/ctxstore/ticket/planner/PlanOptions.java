package eu.virtualparadox.ctxstore.ticket.planner;

/**
 * @param limit          maximum number of recommended tickets, at least 1
 * @param includeTesting whether testing tickets may be recommended
 */
public record PlanOptions(int limit, boolean includeTesting) {

    public static final int DEFAULT_LIMIT = 3;

    public static PlanOptions defaults() {
        return new PlanOptions(DEFAULT_LIMIT, true);
    }
}
