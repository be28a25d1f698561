package eu.virtualparadox.ctxstore.catalog;

import eu.virtualparadox.ctxstore.exception.ValidationException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tag of everything that can own embedding chunks. Wire names are stored in the chunk table
 * and the vector index.
 */
public enum EEntityType {
    BUSINESS_RULE("business_rule"),
    GLOSSARY_ENTRY("glossary_entry"),
    PATTERN("pattern"),
    CONVENTION("convention"),
    DOCUMENT("document"),
    TICKET("ticket");

    private final String wireName;

    EEntityType(final String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isContext() {
        return this != TICKET;
    }

    /**
     * @return the five context entity types, the default search set
     */
    public static Set<EEntityType> contextTypes() {
        return EnumSet.of(BUSINESS_RULE, GLOSSARY_ENTRY, PATTERN, CONVENTION, DOCUMENT);
    }

    public static EEntityType fromValue(final String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("entity type must not be blank");
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown entity type: " + value,
                        Map.of("entityType", value)));
    }

    /**
     * Parses a context type; tickets are rejected.
     */
    public static EEntityType contextFromValue(final String value) {
        final EEntityType type = fromValue(value);
        if (!type.isContext()) {
            throw new ValidationException("Not a context entity type: " + value, Map.of("entityType", value));
        }
        return type;
    }
}
