package eu.virtualparadox.ctxstore.rag.retriever.model;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import lombok.Builder;

import java.util.Set;

/**
 * Parameters of a semantic search. {@code null} values fall back to the configured defaults.
 *
 * @param repoId        repo to search
 * @param projectId     optional project; when set its embeddings are searched in addition to the repo's
 * @param entityTypes   types to search, defaults to all context types
 * @param topK          maximum number of matches, at least 1
 * @param minSimilarity lowest accepted cosine similarity, within {@code [0, 1]}
 */
@Builder(toBuilder = true)
public record SearchOptions(String repoId,
                            String projectId,
                            Set<EEntityType> entityTypes,
                            Integer topK,
                            Double minSimilarity) {

    public static SearchOptions ofRepo(final String repoId) {
        return SearchOptions.builder().repoId(repoId).build();
    }
}
