package eu.virtualparadox.ctxstore.ticket;

import eu.virtualparadox.ctxstore.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

public enum ETicketStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    BLOCKED("blocked");

    private final String value;

    ETicketStatus(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ETicketStatus fromValue(final String value) {
        if (value == null) {
            throw new ValidationException("status must not be null");
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown ticket status: " + value,
                        Map.of("status", value)));
    }
}
