package eu.virtualparadox.ctxstore.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_ENTITY_KEY = "entityKey";
    public static final String FIELD_ENTITY_TYPE = "entityType";
    public static final String FIELD_ENTITY_ID = "entityId";
    public static final String FIELD_CHUNK_INDEX = "chunkIndex";
    public static final String FIELD_REPO_ID = "repoId";
    public static final String FIELD_PROJECT_ID = "projectId";

    /**
     * Stored in {@link #FIELD_PROJECT_ID} for repo-level embeddings, so they can be matched by a term query.
     */
    public static final String REPO_LEVEL = "__repo__";

    private LuceneConstants() {
        // prevent instantiation
    }

    public static String entityKey(final String entityType, final String entityId) {
        return entityType + ":" + entityId;
    }
}
