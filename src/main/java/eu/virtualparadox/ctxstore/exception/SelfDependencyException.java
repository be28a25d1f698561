package eu.virtualparadox.ctxstore.exception;

import java.util.Map;

/** A ticket was asked to depend on itself. */
public class SelfDependencyException extends ContextStoreException {

    public SelfDependencyException(final String ticket) {
        super(EErrorCode.SELF_DEPENDENCY, "Ticket cannot depend on itself: " + ticket, Map.of("ticket", ticket));
    }
}
