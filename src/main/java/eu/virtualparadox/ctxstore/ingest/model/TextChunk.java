package eu.virtualparadox.ctxstore.ingest.model;

/**
 * Immutable slice of a source text produced by the chunker.
 * <p>{@code startOffset} is inclusive and {@code endOffset} exclusive, both in UTF-16 characters.</p>
 */
public record TextChunk(String text, int index, int totalChunks, int startOffset, int endOffset) {

    public static TextChunk ofWholeText(final String text) {
        return new TextChunk(text, 0, 1, 0, text.length());
    }
}
