package eu.virtualparadox.ctxstore.rag.index;

/**
 * Raw nearest-neighbour hit for a single chunk.
 *
 * @param similarity cosine similarity in {@code [-1, 1]}
 * @param projectId  {@code null} for repo-level chunks
 */
public record VectorHit(String entityType,
                        String entityId,
                        int chunkIndex,
                        String repoId,
                        String projectId,
                        double similarity) {
}
