package eu.virtualparadox.laysum.rag.draft.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured summary draft as produced by the generator and corrected by the verifier.
 * Immutable; the {@code with*} methods return modified copies.
 *
 * @param mode              requested summary shape
 * @param laySummary        summary prose
 * @param headline          short title for a lay reader
 * @param keywords          keywords in generator order
 * @param jargonDefinitions term to plain-language definition, in generator order
 * @param sentences         the cited sentences of the summary
 */
public record Draft(SummaryMode mode,
                    String laySummary,
                    String headline,
                    List<String> keywords,
                    Map<String, String> jargonDefinitions,
                    List<SentenceClaim> sentences) {

    public Draft {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(laySummary, "laySummary must not be null");
        Objects.requireNonNull(headline, "headline must not be null");
        keywords = List.copyOf(keywords);
        jargonDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(jargonDefinitions));
        sentences = List.copyOf(sentences);
    }

    public Draft withSentences(final List<SentenceClaim> newSentences) {
        return new Draft(mode, laySummary, headline, keywords, jargonDefinitions, newSentences);
    }

    public Draft withLaySummary(final String newLaySummary) {
        return new Draft(mode, newLaySummary, headline, keywords, jargonDefinitions, sentences);
    }
}
