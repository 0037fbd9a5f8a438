package eu.virtualparadox.laysum.rag.draft.service;

import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.SentenceClaim;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Reports where a draft breaks the structural rules given to the generator.
 * <p>The checker only reports; enforcing (rejecting, regenerating) is left to the caller.</p>
 */
@Component
public class DraftShapeChecker {

    static final int MICRO_SENTENCES = 3;
    static final int MICRO_MAX_WORDS = 200;
    static final int EXTENDED_PARAGRAPHS = 5;
    static final int EXTENDED_MAX_WORDS = 350;

    /**
     * @param draft       the draft to check
     * @param evidenceIds ids of the passages that were in the evidence pool
     * @return human readable violations, empty when the draft is well-formed
     */
    public List<String> check(final Draft draft, final Set<Integer> evidenceIds) {
        final List<String> violations = new ArrayList<>();
        final int words = countWords(draft.laySummary());

        if (draft.mode() == SummaryMode.MICRO) {
            if (draft.sentences().size() != MICRO_SENTENCES) {
                violations.add("micro draft has " + draft.sentences().size()
                        + " sentences, expected " + MICRO_SENTENCES);
            }
            if (words > MICRO_MAX_WORDS) {
                violations.add("micro summary has " + words + " words, limit is " + MICRO_MAX_WORDS);
            }
        } else {
            final int paragraphs = countParagraphs(draft.laySummary());
            if (paragraphs != EXTENDED_PARAGRAPHS) {
                violations.add("extended summary has " + paragraphs
                        + " paragraphs, expected " + EXTENDED_PARAGRAPHS);
            }
            if (words > EXTENDED_MAX_WORDS) {
                violations.add("extended summary has " + words + " words, limit is " + EXTENDED_MAX_WORDS);
            }
        }

        final List<SentenceClaim> sentences = draft.sentences();
        for (int i = 0; i < sentences.size(); i++) {
            final boolean citesPool = sentences.get(i).citations().stream().anyMatch(evidenceIds::contains);
            if (!citesPool) {
                violations.add("sentence " + i + " cites no passage of the evidence pool");
            }
        }
        return violations;
    }

    static int countWords(final String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }

    static int countParagraphs(final String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return (int) Arrays.stream(text.strip().split("\\n\\s*\\n"))
                .filter(p -> !p.isBlank())
                .count();
    }
}
