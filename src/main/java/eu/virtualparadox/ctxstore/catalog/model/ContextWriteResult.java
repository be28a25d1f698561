package eu.virtualparadox.ctxstore.catalog.model;

import eu.virtualparadox.ctxstore.catalog.entity.ContextEntity;
import eu.virtualparadox.ctxstore.ingest.lifecycle.ESyncOutcome;

/**
 * A persisted context entity together with the outcome of its embedding sync.
 */
public record ContextWriteResult(ContextEntity entity, ESyncOutcome syncOutcome) {
}
