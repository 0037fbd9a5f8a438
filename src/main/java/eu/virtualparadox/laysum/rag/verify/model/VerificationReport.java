package eu.virtualparadox.laysum.rag.verify.model;

import eu.virtualparadox.laysum.rag.draft.model.Draft;

import java.util.List;

/**
 * @param draft    the checked draft
 * @param outcomes one outcome per sentence, in sentence order
 */
public record VerificationReport(Draft draft, List<SentenceOutcome> outcomes) {

    public VerificationReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(final VerificationState state) {
        return outcomes.stream().filter(o -> o.state() == state).count();
    }

    public List<SentenceOutcome> failures() {
        return outcomes.stream().filter(SentenceOutcome::isFailed).toList();
    }
}
