package eu.virtualparadox.laysum.rag.rank.service;

import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.rank.model.ScoredChunk;

import java.util.List;

/**
 * Orders the passages of one document by relevance to a query.
 */
public interface RelevanceRanker {

    /**
     * Scores every passage against {@code query}.
     *
     * @param chunks passages of one document, in document order
     * @param query  free-text query
     * @return all passages, highest score first; equal scores keep document order
     */
    List<ScoredChunk> score(List<Chunk> chunks, String query);

    /**
     * Returns the {@code k} most relevant passages.
     *
     * @param chunks passages of one document, in document order
     * @param query  free-text query
     * @param k      maximum number of passages to return (non-negative)
     * @return the first {@code min(k, chunks.size())} passages of {@link #score(List, String)}
     * @throws IllegalArgumentException if {@code k} is negative
     */
    default List<Chunk> rank(final List<Chunk> chunks, final String query, final int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative, got " + k);
        }
        return score(chunks, query).stream()
                .limit(k)
                .map(ScoredChunk::chunk)
                .toList();
    }
}
