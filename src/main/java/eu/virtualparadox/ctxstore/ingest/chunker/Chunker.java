package eu.virtualparadox.ctxstore.ingest.chunker;

import eu.virtualparadox.ctxstore.ingest.model.TextChunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window text {@code Chunker} producing overlapping chunks for embedding.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Short text:</strong> a text of at most {@code maxChunkSize} characters yields exactly
 *       one chunk spanning the whole text.</li>
 *   <li><strong>Window:</strong> otherwise each chunk covers at most {@code maxChunkSize} characters.
 *       The window end is moved back to a natural boundary found in the back half of the window,
 *       preferring a paragraph break, then a sentence end, then any whitespace. Without a boundary
 *       the window is cut hard.</li>
 *   <li><strong>Exact overlap:</strong> the next chunk starts exactly {@code overlap} characters
 *       before the previous chunk's end, so consecutive chunks share exactly {@code overlap}
 *       characters and the union of all ranges is the whole text.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction. The output depends only on the input text and the configured sizes.
 */
@Component
public class Chunker {

    /**
     * Strict upper bound on the length of a chunk.
     */
    private final int maxChunkSize;

    /**
     * Number of characters shared by consecutive chunks.
     */
    private final int overlap;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param maxChunkSize upper bound on the chunk length (must be {@code > 0})
     * @param overlap      characters shared by consecutive chunks
     *                     (must be {@code >= 0} and {@code < maxChunkSize})
     * @throws IllegalArgumentException if constraints are violated
     */
    public Chunker(@Value("${chunker.max-chars:800}") final int maxChunkSize,
                   @Value("${chunker.overlap-chars:100}") final int overlap) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        if (overlap < 0 || overlap >= maxChunkSize) {
            throw new IllegalArgumentException("overlap must be non-negative and less than maxChunkSize");
        }
        this.maxChunkSize = maxChunkSize;
        this.overlap = overlap;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    public int overlap() {
        return overlap;
    }

    /**
     * Splits {@code text} into ordered, overlapping chunks.
     *
     * @param text input text (non-null)
     * @return chunks covering {@code text} without gaps; empty for an empty text
     * @throws IllegalArgumentException if {@code text} is null
     */
    public List<TextChunk> chunk(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        final int len = text.length();
        if (len == 0) {
            return List.of();
        }
        if (len <= maxChunkSize) {
            return List.of(TextChunk.ofWholeText(text));
        }

        final List<int[]> ranges = new ArrayList<>();
        int start = 0;
        while (true) {
            int end = Math.min(start + maxChunkSize, len);
            if (end < len) {
                end = findBoundary(text, start, end);
            }
            ranges.add(new int[]{start, end});
            if (end >= len) {
                break;
            }
            start = end - overlap;
        }

        final int total = ranges.size();
        final List<TextChunk> result = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            final int[] r = ranges.get(i);
            result.add(new TextChunk(text.substring(r[0], r[1]), i, total, r[0], r[1]));
        }
        return result;
    }

    /**
     * Finds the best cut position in {@code (lower, end]}, where {@code lower} keeps the cut in the
     * back half of the window and far enough from {@code start} for the next window to advance.
     *
     * @return a boundary position, or {@code end} for a hard cut
     */
    private int findBoundary(final String text, final int start, final int end) {
        final int lower = Math.max(start + maxChunkSize / 2, start + overlap + 1);
        if (lower > end) {
            return end;
        }

        // paragraph break: cut right after "\n\n"
        for (int c = end; c >= lower; c--) {
            if (c >= 2 && text.charAt(c - 1) == '\n' && text.charAt(c - 2) == '\n') {
                return c;
            }
        }

        // sentence end: cut right after the whitespace following . ! ?
        for (int c = end; c >= lower; c--) {
            if (c >= 2 && Character.isWhitespace(text.charAt(c - 1)) && isSentenceEnd(text.charAt(c - 2))) {
                return c;
            }
        }

        // any whitespace
        for (int c = end; c >= lower; c--) {
            if (Character.isWhitespace(text.charAt(c - 1))) {
                return c;
            }
        }
        return end;
    }

    private static boolean isSentenceEnd(final char ch) {
        return ch == '.' || ch == '!' || ch == '?';
    }
}
