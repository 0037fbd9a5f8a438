package eu.virtualparadox.laysum.summary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The finished lay summary of one document. Immutable; serialized with snake_case keys
 * in declaration order.
 */
@JsonPropertyOrder({"mode", "lay_summary", "headline", "keywords", "jargon_definitions",
        "sentences", "reading_level", "disclaimers", "language"})
public record Payload(@JsonProperty("mode") SummaryMode mode,
                      @JsonProperty("lay_summary") String laySummary,
                      @JsonProperty("headline") String headline,
                      @JsonProperty("keywords") List<String> keywords,
                      @JsonProperty("jargon_definitions") Map<String, String> jargonDefinitions,
                      @JsonProperty("sentences") List<PayloadSentence> sentences,
                      @JsonProperty("reading_level") ReadingMetrics readingLevel,
                      @JsonProperty("disclaimers") List<String> disclaimers,
                      @JsonProperty("language") String language) {

    public Payload {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(laySummary, "laySummary must not be null");
        Objects.requireNonNull(headline, "headline must not be null");
        Objects.requireNonNull(readingLevel, "readingLevel must not be null");
        Objects.requireNonNull(language, "language must not be null");
        keywords = List.copyOf(keywords);
        jargonDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(jargonDefinitions));
        sentences = List.copyOf(sentences);
        disclaimers = List.copyOf(disclaimers);
    }
}
