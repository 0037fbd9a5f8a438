package eu.virtualparadox.laysum.rag.verify.citation;

import eu.virtualparadox.laysum.ingest.model.Chunk;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Passages behind a sentence's citations.
 *
 * @param chunks     cited passages found in the document, in citation order
 * @param droppedIds cited ids with no passage in the document
 */
public record ResolvedEvidence(List<Chunk> chunks, List<Integer> droppedIds) {

    public ResolvedEvidence {
        chunks = List.copyOf(chunks);
        droppedIds = List.copyOf(droppedIds);
    }

    public List<Integer> validIds() {
        return chunks.stream().map(Chunk::id).toList();
    }

    /**
     * @return passage texts joined by newlines, the evidence handed to entailment and rewrite
     */
    public String text() {
        return chunks.stream().map(Chunk::text).collect(Collectors.joining("\n"));
    }
}
