package eu.virtualparadox.ctxstore.ticket;

import eu.virtualparadox.ctxstore.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

public enum ETicketType {
    SETUP("setup"),
    IMPLEMENTATION("implementation"),
    TESTING("testing"),
    DOCUMENTATION("documentation");

    private final String value;

    ETicketType(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ETicketType fromValue(final String value) {
        if (value == null) {
            throw new ValidationException("type must not be null");
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown ticket type: " + value,
                        Map.of("type", value)));
    }
}
