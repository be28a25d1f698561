package eu.virtualparadox.ctxstore.api.model;

/**
 * @param embeddingResynced whether the update changed the embedded text and new embeddings were stored
 */
public record UpdateContextResult(boolean updated, boolean embeddingResynced) {
}
