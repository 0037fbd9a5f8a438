package eu.virtualparadox.laysum.rag.draft.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported summary shapes.
 * <ul>
 *   <li>{@link #MICRO}: exactly three sentences (problem, approach and finding, significance), at most 200 words.</li>
 *   <li>{@link #EXTENDED}: five paragraphs (background, method, findings, implications, limitations), at most 350 words.</li>
 * </ul>
 */
public enum SummaryMode {
    MICRO("micro"),
    EXTENDED("extended");

    private final String wireName;

    SummaryMode(final String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<SummaryMode> fromWireName(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        final String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (final SummaryMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
