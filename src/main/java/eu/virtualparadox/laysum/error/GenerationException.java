package eu.virtualparadox.laysum.error;

/**
 * The generation capability failed (transport, authentication, quota or timeout).
 * Fatal for the current document; the caller may retry the whole pipeline.
 */
public class GenerationException extends LaySummaryException {

    public GenerationException(final String documentId, final String message) {
        super(documentId, message);
    }

    public GenerationException(final String documentId, final String message, final Throwable cause) {
        super(documentId, message, cause);
    }
}
