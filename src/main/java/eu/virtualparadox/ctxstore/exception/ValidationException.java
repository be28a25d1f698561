package eu.virtualparadox.ctxstore.exception;

import java.util.Map;

/** Input validation failure. Nothing is written when it is raised. */
public class ValidationException extends ContextStoreException {

    public ValidationException(final String message) {
        super(EErrorCode.INVALID_ARGUMENT, message);
    }

    public ValidationException(final String message, final Map<String, ?> context) {
        super(EErrorCode.INVALID_ARGUMENT, message, context);
    }
}
