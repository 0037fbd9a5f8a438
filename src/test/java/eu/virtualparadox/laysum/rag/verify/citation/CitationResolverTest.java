package eu.virtualparadox.laysum.rag.verify.citation;

import eu.virtualparadox.laysum.ingest.model.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static eu.virtualparadox.laysum.support.Fixtures.byId;
import static eu.virtualparadox.laysum.support.Fixtures.chunk;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CitationResolverTest {

    private final CitationResolver resolver = new CitationResolver();
    private final Map<Integer, Chunk> chunks = byId(chunk(0, "Zero."), chunk(1, "One."), chunk(2, "Two."));

    @Test
    @DisplayName("Evidence follows citation order and is joined by newlines")
    void citationOrder() {
        ResolvedEvidence evidence = resolver.resolve(List.of(2, 0), chunks);

        assertEquals(List.of(2, 0), evidence.validIds());
        assertEquals("Two.\nZero.", evidence.text());
        assertTrue(evidence.droppedIds().isEmpty());
    }

    @Test
    @DisplayName("Unknown ids are skipped and reported")
    void unknownIds() {
        ResolvedEvidence evidence = resolver.resolve(List.of(5, 1, 99), chunks);

        assertEquals(List.of(1), evidence.validIds());
        assertEquals(List.of(5, 99), evidence.droppedIds());
        assertEquals("One.", evidence.text());
    }

    @Test
    @DisplayName("No citations yield empty evidence")
    void empty() {
        ResolvedEvidence evidence = resolver.resolve(List.of(), chunks);
        assertEquals("", evidence.text());
        assertTrue(evidence.chunks().isEmpty());
    }
}
