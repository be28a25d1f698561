package eu.virtualparadox.ctxstore.rag.index;

import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;
import eu.virtualparadox.ctxstore.rag.embed.repo.EmbeddingChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Keeps the Lucene index aligned with the {@code embedding_chunks} table.
 * <p>No transaction spans both stores, so after a crash or with an in-memory index the two can
 * disagree. On startup the index is rebuilt from the table whenever their chunk counts differ.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexRebuildService {

    private final EmbeddingChunkRepository chunkRepository;
    private final VectorIndexService vectorIndexService;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        try {
            rebuildIfStale();
        } catch (IOException e) {
            log.error("Unable to verify vector index against the chunk table", e);
        }
    }

    /**
     * @return {@code true} if the index was rebuilt
     */
    public boolean rebuildIfStale() throws IOException {
        final long stored = chunkRepository.count();
        final int indexed = vectorIndexService.count();
        if (stored == indexed) {
            log.info("Vector index is consistent ({} chunks)", indexed);
            return false;
        }
        log.warn("Vector index has {} chunks but the table has {}; rebuilding", indexed, stored);
        rebuild();
        return true;
    }

    public void rebuild() throws IOException {
        final List<EmbeddingChunkEntity> chunks = chunkRepository.findAll();
        vectorIndexService.rebuild(chunks);
    }
}
