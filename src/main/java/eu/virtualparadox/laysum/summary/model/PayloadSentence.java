package eu.virtualparadox.laysum.summary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A verified sentence of the payload.
 *
 * @param text      sentence text
 * @param citations ids of the passages supporting it
 * @param spans     source regions of those passages, one per citation found in the document
 */
@JsonPropertyOrder({"text", "citations", "spans"})
public record PayloadSentence(@JsonProperty("text") String text,
                              @JsonProperty("citations") List<Integer> citations,
                              @JsonProperty("spans") List<EvidenceSpan> spans) {

    public PayloadSentence {
        Objects.requireNonNull(text, "text must not be null");
        citations = List.copyOf(citations);
        spans = List.copyOf(spans);
    }
}
