package eu.virtualparadox.ctxstore.rag.embed;

/**
 * Turns text into dense, L2-normalised vectors.
 */
public interface EmbeddingService {

    /**
     * Embeds one chunk of a stored entity.
     *
     * @param text chunk text
     * @return normalised vector
     */
    float[] embed(String text);

    /**
     * Embeds a search query. Implementations may treat queries differently from passages.
     */
    default float[] embedQuery(final String text) {
        return embed(text);
    }

    /**
     * @return identifier of the model, stored alongside every vector
     */
    String modelName();
}
