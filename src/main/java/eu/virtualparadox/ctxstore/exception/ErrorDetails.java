package eu.virtualparadox.ctxstore.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Structured error information handed to callers instead of a thrown exception.
 */
public record ErrorDetails(String type,
                           String message,
                           EErrorCode code,
                           Map<String, Object> context,
                           Instant timestamp) {

    public static ErrorDetails of(final ContextStoreException e) {
        return new ErrorDetails(e.getClass().getSimpleName(), e.getMessage(), e.getCode(), e.getContext(), Instant.now());
    }

    public static ErrorDetails internal(final Exception e) {
        return new ErrorDetails(e.getClass().getSimpleName(), String.valueOf(e.getMessage()), EErrorCode.INTERNAL,
                Map.of(), Instant.now());
    }
}
