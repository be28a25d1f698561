package eu.virtualparadox.ctxstore.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception of the store, carrying an {@link EErrorCode} and optional context.
 * <p>The context map is copied and unmodifiable.</p>
 */
public class ContextStoreException extends RuntimeException {

    private final EErrorCode code;
    private final Map<String, Object> context;

    public ContextStoreException(final EErrorCode code, final String message) {
        this(code, message, Collections.emptyMap(), null);
    }

    public ContextStoreException(final EErrorCode code, final String message, final Throwable cause) {
        this(code, message, Collections.emptyMap(), cause);
    }

    public ContextStoreException(final EErrorCode code, final String message, final Map<String, ?> context) {
        this(code, message, context, null);
    }

    public ContextStoreException(final EErrorCode code,
                                 final String message,
                                 final Map<String, ?> context,
                                 final Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public EErrorCode getCode() {
        return code;
    }

    /** Key/value details identifying the offending input. */
    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(final Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        final Map<String, Object> m = new LinkedHashMap<>(input);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
