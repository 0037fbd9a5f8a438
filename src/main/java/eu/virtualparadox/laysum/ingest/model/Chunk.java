package eu.virtualparadox.laysum.ingest.model;

/**
 * Immutable, offset-addressed passage of a document.
 * <p>The {@code id} is the only key used to cite a passage throughout the pipeline.
 * {@code text} is always {@code source.substring(start, end)}.</p>
 *
 * @param id    sequence number, unique within the document, starting at 0
 * @param page  page index of the passage (0 when the source has no page information)
 * @param start inclusive start offset into the source text
 * @param end   exclusive end offset into the source text
 * @param text  the passage text
 */
public record Chunk(int id, int page, int start, int end, String text) {

    public int length() {
        return end - start;
    }
}
