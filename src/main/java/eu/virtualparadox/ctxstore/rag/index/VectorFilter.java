package eu.virtualparadox.ctxstore.rag.index;

import java.util.Set;

/**
 * Restricts a vector search to a scope.
 *
 * @param repoId      required repo
 * @param projectId   when {@code null} only repo-level chunks match; otherwise repo-level plus this project
 * @param entityTypes wire names of the allowed entity types, never empty
 */
public record VectorFilter(String repoId, String projectId, Set<String> entityTypes) {
}
