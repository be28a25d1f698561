package eu.virtualparadox.ctxstore.rag.retriever.model;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.ingest.model.Embeddable;

import java.time.Instant;

/**
 * A ranked search match hydrated to its owning entity.
 * <p>The chunk fields describe the best-scoring chunk of the entity; the excerpt is that chunk's
 * slice of the canonical text.</p>
 */
public record EntityMatch(EEntityType entityType,
                          String entityId,
                          String title,
                          double similarity,
                          EProvenance provenance,
                          String repoId,
                          String projectId,
                          int chunkIndex,
                          int totalChunks,
                          int chunkStartOffset,
                          int chunkEndOffset,
                          String excerpt,
                          Instant updatedAt,
                          Embeddable entity) {
}
