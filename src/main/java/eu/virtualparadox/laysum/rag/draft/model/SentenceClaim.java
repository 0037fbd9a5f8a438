package eu.virtualparadox.laysum.rag.draft.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One summary sentence and the passages it claims support from.
 *
 * @param text      sentence text
 * @param citations passage ids, distinct, in the order the generator listed them
 */
public record SentenceClaim(String text, List<Integer> citations) {

    public SentenceClaim {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(citations, "citations must not be null");
        citations = List.copyOf(new LinkedHashSet<>(citations));
    }

    public SentenceClaim withText(final String newText) {
        return new SentenceClaim(newText, citations);
    }

    public SentenceClaim withCitations(final List<Integer> newCitations) {
        return new SentenceClaim(text, newCitations);
    }
}
