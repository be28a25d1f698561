package eu.virtualparadox.ctxstore.exception;

import java.util.Map;

/** Requested entity, ticket, repo or project does not exist. */
public class NotFoundException extends ContextStoreException {

    public NotFoundException(final String kind, final String id) {
        super(EErrorCode.NOT_FOUND, kind + " not found: " + id, Map.of("kind", kind, "id", id));
    }
}
