package eu.virtualparadox.laysum.ingest.chunker;

import eu.virtualparadox.laysum.error.ChunkerConfigException;
import eu.virtualparadox.laysum.ingest.model.Chunk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sentence-aligned sliding window {@code Chunker} producing overlapping passages.
 *
 * <h2>Algorithm</h2>
 * <ul>
 *   <li><strong>Window:</strong> starting at {@code start}, take up to {@code window} characters.</li>
 *   <li><strong>Sentence alignment:</strong> if the last {@code '.'} of the slice lies beyond the
 *       slice midpoint ({@code index > window * 0.5}), the slice is cut right after it, so that a
 *       passage does not end mid-sentence. Otherwise the full window is kept.</li>
 *   <li><strong>Overlap:</strong> the next window starts {@code overlap} characters before the end
 *       of the previous passage. If that would not move past the previous start, the next window
 *       starts at the previous end instead.</li>
 *   <li><strong>Termination:</strong> the scan stops once a passage reaches the end of the text.</li>
 * </ul>
 *
 * <h2>Guarantees</h2>
 * Passages are non-empty, carry absolute offsets with {@code text == source[start, end)}, and their
 * ranges cover {@code [0, text.length())} without gaps. Output is deterministic and the component is
 * stateless after construction, thus thread-safe.
 */
@Component
public class Chunker {

    public static final int DEFAULT_WINDOW = 1200;
    public static final int DEFAULT_OVERLAP = 200;

    private static final char SENTENCE_TERMINATOR = '.';

    /**
     * Maximum passage length in characters.
     */
    private final int window;

    /**
     * Number of characters shared by consecutive passages.
     */
    private final int overlap;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param window  maximum passage length (must be {@code > 0})
     * @param overlap characters shared between consecutive passages (must be {@code >= 0} and {@code < window})
     * @throws ChunkerConfigException if constraints are violated
     */
    public Chunker(@Value("${chunker.window:1200}") final int window,
                   @Value("${chunker.overlap:200}") final int overlap) {
        if (window <= 0) {
            throw new ChunkerConfigException("window must be positive, got " + window);
        }
        if (overlap < 0 || overlap >= window) {
            throw new ChunkerConfigException(
                    "overlap must be non-negative and less than window (window=" + window + ", overlap=" + overlap + ")");
        }
        this.window = window;
        this.overlap = overlap;
    }

    /**
     * Splits {@code text} into overlapping, sentence-aligned passages.
     *
     * @param text source text (non-null, may be empty)
     * @return ordered passages with ids {@code 0..n-1}; empty for empty text
     */
    public List<Chunk> chunk(final String text) {
        Objects.requireNonNull(text, "text must not be null");

        final List<Chunk> result = new ArrayList<>();
        final int length = text.length();
        int start = 0;
        int seq = 0;

        while (start < length) {
            final int end = sliceEnd(text, start);
            result.add(new Chunk(seq++, 0, start, end, text.substring(start, end)));

            if (end >= length) {
                break;
            }
            start = nextStart(start, end);
        }
        return result;
    }

    public int getWindow() {
        return window;
    }

    public int getOverlap() {
        return overlap;
    }

    /**
     * End offset of the passage starting at {@code start}: the full window, or just after the last
     * sentence terminator of the window when that terminator lies beyond the window midpoint.
     */
    private int sliceEnd(final String text, final int start) {
        final int end = Math.min(text.length(), start + window);
        final int lastDot = text.lastIndexOf(SENTENCE_TERMINATOR, end - 1);
        final int relative = lastDot - start;
        if (lastDot >= start && relative > window * 0.5) {
            return start + relative + 1;
        }
        return end;
    }

    private int nextStart(final int start, final int end) {
        final int candidate = end - overlap;
        // a short sentence-aligned passage may be shorter than the overlap
        return candidate > start ? candidate : end;
    }
}
