package eu.virtualparadox.ctxstore.ingest.lifecycle;

import eu.virtualparadox.ctxstore.application.config.ApplicationConfig;
import eu.virtualparadox.ctxstore.application.executor.EmbeddingExecutor;
import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.ingest.chunker.Chunker;
import eu.virtualparadox.ctxstore.ingest.hash.ContentHasher;
import eu.virtualparadox.ctxstore.ingest.model.Embeddable;
import eu.virtualparadox.ctxstore.ingest.model.TextChunk;
import eu.virtualparadox.ctxstore.rag.embed.EmbeddingService;
import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;
import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkId;
import eu.virtualparadox.ctxstore.rag.embed.repo.EmbeddingChunkRepository;
import eu.virtualparadox.ctxstore.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps the embedding chunks of an entity in step with its content.
 * <ul>
 *   <li>Chunk table (database), the source of truth</li>
 *   <li>Vector index (Lucene)</li>
 * </ul>
 * <p>An entity is re-embedded only when the hash of its canonical text or the embedding model
 * changed. Generation failures never fail the entity write: they are logged and the next sync retries.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EmbeddingLifecycleManager {

    private final ContentHasher contentHasher;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final EmbeddingExecutor embeddingExecutor;
    private final EmbeddingChunkRepository chunkRepository;
    private final VectorIndexService vectorIndexService;
    private final ApplicationConfig config;

    /**
     * Brings the stored embeddings of {@code entity} up to date.
     *
     * @param entity    context entity or ticket, already persisted
     * @param repoId    owning repo
     * @param projectId owning project, {@code null} for repo-level entities
     * @return what happened
     */
    public ESyncOutcome sync(final Embeddable entity, final String repoId, final String projectId) {
        final String type = entity.getEntityType().wireName();
        final String id = entity.getId();

        final String canonical = contentHasher.canonicalText(entity);
        final String newHash = contentHasher.hash(canonical);
        final String model = embeddingService.modelName();

        final Optional<EmbeddingChunkEntity> head = chunkRepository.findById(new EmbeddingChunkId(type, id, 0));
        if (head.isPresent()
                && newHash.equals(head.get().getContentHash())
                && model.equals(head.get().getEmbeddingModel())) {
            log.debug("Embeddings of {} {} are up to date", type, id);
            return ESyncOutcome.UNCHANGED;
        }

        if (head.isPresent()) {
            remove(entity.getEntityType(), id);
        }

        final List<TextChunk> chunks = chunker.chunk(canonical);
        if (chunks.isEmpty()) {
            log.warn("Nothing to embed for {} {}", type, id);
            return ESyncOutcome.FAILED;
        }

        final List<float[]> vectors;
        try {
            vectors = generate(chunks);
        } catch (TimeoutException e) {
            log.warn("Embedding of {} {} timed out after {}; will retry on next write",
                    type, id, config.getEmbeddingTimeout());
            return ESyncOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Embedding of {} {} was interrupted", type, id);
            return ESyncOutcome.FAILED;
        } catch (ExecutionException | RuntimeException e) {
            log.warn("Embedding of {} {} failed; will retry on next write", type, id, e);
            return ESyncOutcome.FAILED;
        }

        final Instant now = Instant.now();
        final List<EmbeddingChunkEntity> rows = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            final TextChunk c = chunks.get(i);
            final float[] vec = vectors.get(i);
            rows.add(EmbeddingChunkEntity.builder()
                    .id(new EmbeddingChunkId(type, id, c.index()))
                    .repoId(repoId)
                    .projectId(projectId)
                    .vector(vec)
                    .embeddingModel(model)
                    .dimension(vec.length)
                    .contentHash(newHash)
                    .totalChunks(c.totalChunks())
                    .chunkStartOffset(c.startOffset())
                    .chunkEndOffset(c.endOffset())
                    .createdAt(now)
                    .build());
        }
        chunkRepository.saveAll(rows);

        try {
            vectorIndexService.add(rows);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to index embeddings of {} {}; index will be rebuilt on next start", type, id, e);
        }

        log.info("Embedded {} {} into {} chunk(s)", type, id, rows.size());
        return ESyncOutcome.REEMBEDDED;
    }

    /**
     * Removes every embedding chunk of an entity from the index and the chunk table.
     * <p>Idempotent. An index failure is logged and the rows are still removed.</p>
     *
     * @return number of removed chunk rows
     */
    public int remove(final EEntityType entityType, final String entityId) {
        final String type = entityType.wireName();
        try {
            vectorIndexService.deleteByEntity(type, entityId);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to remove {} {} from the vector index", type, entityId, e);
        }
        final int removed = chunkRepository.deleteByEntity(type, entityId);
        log.debug("Removed {} chunk(s) of {} {}", removed, type, entityId);
        return removed;
    }

    /**
     * @return stored chunks of an entity ordered by chunk index
     */
    public List<EmbeddingChunkEntity> chunksOf(final EEntityType entityType, final String entityId) {
        return chunkRepository.findByEntity(entityType.wireName(), entityId);
    }

    /**
     * Embeds the chunks one by one on the embedding executor, each bounded by the configured timeout.
     */
    private List<float[]> generate(final List<TextChunk> chunks)
            throws InterruptedException, ExecutionException, TimeoutException {
        final long timeoutMillis = config.getEmbeddingTimeout().toMillis();
        final List<float[]> vectors = new ArrayList<>(chunks.size());
        for (final TextChunk chunk : chunks) {
            final Future<float[]> future = embeddingExecutor.submit(() -> embeddingService.embed(chunk.text()));
            try {
                vectors.add(future.get(timeoutMillis, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                throw e;
            }
        }
        return vectors;
    }
}
