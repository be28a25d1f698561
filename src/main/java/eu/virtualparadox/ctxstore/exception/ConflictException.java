package eu.virtualparadox.ctxstore.exception;

import java.util.Map;

/**
 * The request is well formed but clashes with stored state: a duplicate name or title
 * or disabled inheritance.
 */
public class ConflictException extends ContextStoreException {

    public ConflictException(final EErrorCode code, final String message, final Map<String, ?> context) {
        super(code, message, context);
    }

    public static ConflictException alreadyExists(final String kind, final String field, final String value) {
        return new ConflictException(EErrorCode.ALREADY_EXISTS,
                kind + " with " + field + " '" + value + "' already exists",
                Map.of("kind", kind, field, value));
    }

    public static ConflictException precondition(final String message, final Map<String, ?> context) {
        return new ConflictException(EErrorCode.FAILED_PRECONDITION, message, context);
    }
}
