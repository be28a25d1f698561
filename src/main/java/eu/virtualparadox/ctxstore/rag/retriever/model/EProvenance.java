package eu.virtualparadox.ctxstore.rag.retriever.model;

/**
 * Scope a search match came from.
 */
public enum EProvenance {
    REPO,
    PROJECT
}
