package eu.virtualparadox.ctxstore.catalog;

import eu.virtualparadox.ctxstore.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

public enum EDocumentType {
    API_DOC("api-doc"),
    DECISION("decision"),
    POSTMORTEM("postmortem"),
    GENERAL("general");

    private final String value;

    EDocumentType(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EDocumentType fromValue(final String value) {
        if (value == null) {
            throw new ValidationException("documentType must not be null");
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown document type: " + value,
                        Map.of("documentType", value)));
    }
}
