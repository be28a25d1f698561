package eu.virtualparadox.ctxstore.ingest.model;

import eu.virtualparadox.ctxstore.catalog.EEntityType;

import java.time.Instant;

/**
 * Anything whose canonical text is embedded and indexed: context entities and tickets.
 */
public interface Embeddable {

    String getId();

    EEntityType getEntityType();

    /**
     * Short human readable label: name, term, title or category.
     */
    String getDisplayName();

    Instant getUpdatedAt();
}
