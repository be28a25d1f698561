package eu.virtualparadox.ctxstore.exception;

/**
 * Stable error codes surfaced to callers of the store.
 */
public enum EErrorCode {
    INVALID_ARGUMENT,
    NOT_FOUND,
    ALREADY_EXISTS,
    FAILED_PRECONDITION,
    SELF_DEPENDENCY,
    DEPENDENCY_CYCLE,
    INTERNAL
}
