package eu.virtualparadox.laysum.error;

/**
 * The calling thread was interrupted while the pipeline waited for a capability call.
 */
public class PipelineCancelledException extends LaySummaryException {

    public PipelineCancelledException(final String documentId, final Throwable cause) {
        super(documentId, "Summary pipeline cancelled for document " + documentId, cause);
    }
}
