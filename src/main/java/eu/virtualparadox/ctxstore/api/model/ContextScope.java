package eu.virtualparadox.ctxstore.api.model;

/**
 * @param projectId {@code null} for repo-level scope
 */
public record ContextScope(String repoId, String projectId) {

    public static ContextScope repo(final String repoId) {
        return new ContextScope(repoId, null);
    }

    public static ContextScope project(final String repoId, final String projectId) {
        return new ContextScope(repoId, projectId);
    }
}
