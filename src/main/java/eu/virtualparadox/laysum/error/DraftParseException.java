package eu.virtualparadox.laysum.error;

/**
 * The generator output could not be recovered as a JSON draft.
 * <p>Retrying without changing the prompt is unlikely to help, so the raw output
 * is kept for inspection.</p>
 */
public class DraftParseException extends LaySummaryException {

    private final String rawOutput;

    public DraftParseException(final String documentId, final String rawOutput, final Throwable cause) {
        super(documentId, "Generator output is not a JSON draft for document " + documentId, cause);
        this.rawOutput = rawOutput;
    }

    public String getRawOutput() {
        return rawOutput;
    }
}
