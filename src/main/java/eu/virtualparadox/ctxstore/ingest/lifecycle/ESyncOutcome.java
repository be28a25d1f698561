package eu.virtualparadox.ctxstore.ingest.lifecycle;

/**
 * Result of an embedding sync.
 */
public enum ESyncOutcome {
    /** Stored embeddings already match the current content and model. */
    UNCHANGED,
    /** Embeddings were regenerated. */
    REEMBEDDED,
    /** Generation failed or timed out; nothing of the new version was stored. */
    FAILED;

    public boolean resynced() {
        return this == REEMBEDDED;
    }
}
