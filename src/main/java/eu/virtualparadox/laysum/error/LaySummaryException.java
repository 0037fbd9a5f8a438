package eu.virtualparadox.laysum.error;

/**
 * Base class of every failure raised by the summary pipeline.
 * <p>Carries the id of the document being summarized when it is known, so that
 * a failure surfacing at the job boundary can be attributed without extra context.</p>
 */
public class LaySummaryException extends RuntimeException {

    private final String documentId;

    public LaySummaryException(final String documentId, final String message) {
        super(message);
        this.documentId = documentId;
    }

    public LaySummaryException(final String documentId, final String message, final Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    /**
     * @return id of the document being processed, or {@code null} if not known at the raise site
     */
    public String getDocumentId() {
        return documentId;
    }
}
