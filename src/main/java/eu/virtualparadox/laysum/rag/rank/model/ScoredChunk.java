package eu.virtualparadox.laysum.rag.rank.model;

import eu.virtualparadox.laysum.ingest.model.Chunk;

/**
 * @param chunk the scored passage
 * @param score BM25 relevance against the query (higher = better, 0 when no query term matches)
 */
public record ScoredChunk(Chunk chunk, float score) {

}
