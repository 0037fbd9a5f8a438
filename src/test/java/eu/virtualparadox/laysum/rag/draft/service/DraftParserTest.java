package eu.virtualparadox.laysum.rag.draft.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.laysum.error.DraftParseException;
import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.SentenceClaim;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DraftParserTest {

    private static final String CLEAN = """
            {
              "mode": "micro",
              "lay_summary": "Plants need light. They were grown in the dark. Growth stopped.",
              "headline": "Plants in the dark",
              "keywords": ["plants", "light"],
              "jargon_definitions": {"photosynthesis": "how plants make food from light", "chlorophyll": "green pigment"},
              "sentences": [
                {"text": "Plants need light.", "citations": [0]},
                {"text": "They were grown in the dark.", "citations": [1, 2]},
                {"text": "Growth stopped.", "citations": [2]}
              ]
            }
            """;

    private final DraftParser parser = new DraftParser(new ObjectMapper());

    @Test
    @DisplayName("Clean JSON is decoded into a typed draft")
    void cleanJson() {
        Draft draft = parser.parse("doc", CLEAN, SummaryMode.MICRO);

        assertEquals(SummaryMode.MICRO, draft.mode());
        assertEquals("Plants in the dark", draft.headline());
        assertEquals(List.of("plants", "light"), draft.keywords());
        assertThat(draft.jargonDefinitions().keySet()).containsExactly("photosynthesis", "chlorophyll");
        assertEquals(List.of(
                new SentenceClaim("Plants need light.", List.of(0)),
                new SentenceClaim("They were grown in the dark.", List.of(1, 2)),
                new SentenceClaim("Growth stopped.", List.of(2))), draft.sentences());
    }

    @Test
    @DisplayName("JSON wrapped in prose or a code fence is recovered")
    void noisyPrefixAndSuffix() {
        String noisy = "Sure! Here is the summary:\n```json\n" + CLEAN + "```\nLet me know if you need more.";

        assertEquals(parser.parse("doc", CLEAN, SummaryMode.MICRO), parser.parse("doc", noisy, SummaryMode.MICRO));
    }

    @Test
    @DisplayName("Output without a JSON object fails with the raw output attached")
    void garbage() {
        DraftParseException ex = assertThrows(DraftParseException.class,
                () -> parser.parse("doc-7", "I cannot summarize this paper.", SummaryMode.MICRO));
        assertEquals("doc-7", ex.getDocumentId());
        assertEquals("I cannot summarize this paper.", ex.getRawOutput());

        assertThrows(DraftParseException.class, () -> parser.parse("doc", "prefix { not json } suffix", SummaryMode.MICRO));
        assertThrows(DraftParseException.class, () -> parser.parse("doc", "[1, 2, 3]", SummaryMode.MICRO));
        assertThrows(DraftParseException.class, () -> parser.parse("doc", null, SummaryMode.MICRO));
    }

    @Test
    @DisplayName("Missing or mistyped fields fall back to empty defaults")
    void defaults() {
        Draft draft = parser.parse("doc", "{\"headline\": 42, \"keywords\": \"one\"}", SummaryMode.EXTENDED);

        assertEquals(SummaryMode.EXTENDED, draft.mode());
        assertEquals("", draft.laySummary());
        assertEquals("", draft.headline());
        assertTrue(draft.keywords().isEmpty());
        assertTrue(draft.jargonDefinitions().isEmpty());
        assertTrue(draft.sentences().isEmpty());
    }

    @Test
    @DisplayName("The requested mode wins over the declared one")
    void requestedModeWins() {
        assertEquals(SummaryMode.EXTENDED, parser.parse("doc", CLEAN, SummaryMode.EXTENDED).mode());
    }

    @Test
    @DisplayName("Citations accept numbers and numeric strings, other values are ignored and duplicates removed")
    void citationFormats() {
        String raw = """
                {"sentences": [
                  {"text": "  One.  ", "citations": [3, "4", "[5]", 6.0, -1, "x", 2.5, null, 3]},
                  {"text": "Two.", "citations": 7},
                  {"text": "   ", "citations": [1]},
                  "Three.",
                  42
                ]}
                """;

        List<SentenceClaim> sentences = parser.parse("doc", raw, SummaryMode.MICRO).sentences();

        assertEquals(List.of(
                new SentenceClaim("One.", List.of(3, 4, 5, 6)),
                new SentenceClaim("Two.", List.of(7)),
                new SentenceClaim("Three.", List.of())), sentences);
    }

    @Test
    @DisplayName("Jargon definitions keep generator order and skip non-text values")
    void jargonOrder() {
        Map<String, String> jargon = parser.parse("doc",
                "{\"jargon_definitions\": {\"zeta\": \"z\", \"alpha\": \"a\", \"n\": 1}}", SummaryMode.MICRO)
                .jargonDefinitions();

        assertThat(jargon.keySet()).containsExactly("zeta", "alpha");
    }
}
