package eu.virtualparadox.ctxstore.api.model;

import eu.virtualparadox.ctxstore.exception.ErrorDetails;

/**
 * Outcome of an external operation: either a value or structured error details.
 */
public record OperationResult<T>(boolean success, T value, ErrorDetails error) {

    public static <T> OperationResult<T> success(final T value) {
        return new OperationResult<>(true, value, null);
    }

    public static <T> OperationResult<T> failure(final ErrorDetails error) {
        return new OperationResult<>(false, null, error);
    }
}
