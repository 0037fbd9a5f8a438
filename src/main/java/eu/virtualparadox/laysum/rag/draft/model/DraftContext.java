package eu.virtualparadox.laysum.rag.draft.model;

import eu.virtualparadox.laysum.summary.model.ReadingMetrics;

import java.util.List;

/**
 * A parsed draft together with the deterministic values computed alongside it.
 *
 * @param draft       the parsed draft
 * @param reading     readability of the draft's lay summary
 * @param disclaimers disclaimers triggered by the document abstract
 */
public record DraftContext(Draft draft, ReadingMetrics reading, List<String> disclaimers) {

    public DraftContext {
        disclaimers = List.copyOf(disclaimers);
    }
}
