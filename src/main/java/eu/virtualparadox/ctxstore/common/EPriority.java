package eu.virtualparadox.ctxstore.common;

import eu.virtualparadox.ctxstore.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Priority shared by business rules and tickets. Lower rank is more urgent.
 */
public enum EPriority {
    CRITICAL("critical", 0),
    HIGH("high", 1),
    MEDIUM("medium", 2),
    LOW("low", 3);

    private final String value;
    private final int rank;

    EPriority(final String value, final int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public static EPriority fromValue(final String value) {
        if (value == null) {
            throw new ValidationException("priority must not be null");
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown priority: " + value,
                        Map.of("priority", value)));
    }
}
