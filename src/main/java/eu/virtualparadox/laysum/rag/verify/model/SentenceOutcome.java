package eu.virtualparadox.laysum.rag.verify.model;

import eu.virtualparadox.laysum.error.VerificationException;
import eu.virtualparadox.laysum.rag.draft.model.SentenceClaim;

import java.util.List;

/**
 * Result of verifying one sentence.
 *
 * @param index             position of the sentence in the draft
 * @param sentence          the sentence after verification (citations limited to known passages)
 * @param state             terminal state, or {@link VerificationState#UNCHECKED} if verification failed
 * @param droppedCitations  cited ids that do not name a passage of the document
 * @param failure           the capability failure, {@code null} on success
 */
public record SentenceOutcome(int index,
                              SentenceClaim sentence,
                              VerificationState state,
                              List<Integer> droppedCitations,
                              VerificationException failure) {

    public SentenceOutcome {
        droppedCitations = List.copyOf(droppedCitations);
    }

    public static SentenceOutcome entailed(final int index, final SentenceClaim sentence, final List<Integer> dropped) {
        return new SentenceOutcome(index, sentence, VerificationState.ENTAILED, dropped, null);
    }

    public static SentenceOutcome rewritten(final int index, final SentenceClaim sentence, final List<Integer> dropped) {
        return new SentenceOutcome(index, sentence, VerificationState.REWRITTEN, dropped, null);
    }

    public static SentenceOutcome failed(final int index,
                                         final SentenceClaim sentence,
                                         final List<Integer> dropped,
                                         final VerificationException failure) {
        return new SentenceOutcome(index, sentence, VerificationState.UNCHECKED, dropped, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
