package eu.virtualparadox.laysum.error;

/**
 * The entailment or rewrite capability failed for one sentence of a draft.
 */
public class VerificationException extends LaySummaryException {

    private final int sentenceIndex;

    public VerificationException(final String documentId,
                                 final int sentenceIndex,
                                 final String message,
                                 final Throwable cause) {
        super(documentId, "Sentence " + sentenceIndex + ": " + message, cause);
        this.sentenceIndex = sentenceIndex;
    }

    public int getSentenceIndex() {
        return sentenceIndex;
    }
}
