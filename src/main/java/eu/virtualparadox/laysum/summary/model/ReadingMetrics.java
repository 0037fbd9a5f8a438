package eu.virtualparadox.laysum.summary.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Readability scores of a text.
 *
 * @param fleschKincaidGrade US school grade needed to understand the text
 * @param fleschReadingEase  0-100 style ease score (higher = easier)
 */
@JsonPropertyOrder({"flesch_kincaid_grade", "flesch_reading_ease"})
public record ReadingMetrics(@JsonProperty("flesch_kincaid_grade") double fleschKincaidGrade,
                             @JsonProperty("flesch_reading_ease") double fleschReadingEase) {

    /**
     * Sentinel used when the scores cannot be computed.
     */
    public static final ReadingMetrics UNAVAILABLE = new ReadingMetrics(-1.0, -1.0);

    @JsonIgnore
    public boolean isAvailable() {
        return !equals(UNAVAILABLE);
    }
}
