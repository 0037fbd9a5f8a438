package eu.virtualparadox.laysum.support;

import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.SentenceClaim;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Fixtures {

    private Fixtures() {
    }

    public static Chunk chunk(final int id, final String text) {
        return new Chunk(id, 0, id * 100, id * 100 + text.length(), text);
    }

    public static Map<Integer, Chunk> byId(final Chunk... chunks) {
        final Map<Integer, Chunk> map = new LinkedHashMap<>();
        for (final Chunk c : chunks) {
            map.put(c.id(), c);
        }
        return map;
    }

    public static SentenceClaim claim(final String text, final Integer... citations) {
        return new SentenceClaim(text, List.of(citations));
    }

    public static Draft draft(final SummaryMode mode, final String laySummary, final SentenceClaim... sentences) {
        return new Draft(mode, laySummary, "A headline", List.of("water", "boiling"),
                Map.of("boiling point", "temperature at which a liquid turns into vapour"), List.of(sentences));
    }
}
