package eu.virtualparadox.ctxstore.rag.index;

import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;

import java.io.IOException;
import java.util.List;

/**
 * Nearest-neighbour index over embedding chunks. The relational chunk table is the source of truth;
 * the index can always be rebuilt from it.
 */
public interface VectorIndexService {

    /**
     * Adds the chunks of one entity and makes them visible to searches.
     */
    void add(List<EmbeddingChunkEntity> chunks) throws IOException;

    /**
     * Removes every chunk of an entity. Removing an unknown entity is a no-op.
     */
    void deleteByEntity(String entityType, String entityId) throws IOException;

    /**
     * Returns up to {@code k} chunks closest to {@code vector} within {@code filter}, best first.
     */
    List<VectorHit> search(float[] vector, VectorFilter filter, int k) throws IOException;

    /**
     * @return number of chunks currently indexed
     */
    int count() throws IOException;

    /**
     * Drops the index content and re-adds {@code chunks}.
     */
    void rebuild(List<EmbeddingChunkEntity> chunks) throws IOException;
}
