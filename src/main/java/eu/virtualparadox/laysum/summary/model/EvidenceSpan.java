package eu.virtualparadox.laysum.summary.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import eu.virtualparadox.laysum.ingest.model.Chunk;

/**
 * Source region behind one citation, so that a reader can highlight it.
 */
@JsonPropertyOrder({"chunk_id", "page", "start", "end"})
public record EvidenceSpan(@JsonProperty("chunk_id") int chunkId,
                           @JsonProperty("page") int page,
                           @JsonProperty("start") int start,
                           @JsonProperty("end") int end) {

    public static EvidenceSpan of(final Chunk chunk) {
        return new EvidenceSpan(chunk.id(), chunk.page(), chunk.start(), chunk.end());
    }
}
