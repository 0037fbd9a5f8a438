package eu.virtualparadox.laysum.rag.verify.citation;

import eu.virtualparadox.laysum.ingest.model.Chunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves citation ids into the passages they name.
 * <p>
 * Unknown ids never fail the run: they are skipped for the evidence text and reported as dropped,
 * so that the caller can remove them from the sentence. Order follows the citation list.
 * </p>
 * <p><strong>Thread-safety:</strong> stateless.</p>
 */
@Component
public final class CitationResolver {

    /**
     * @param citations  cited passage ids, in citation order
     * @param chunksById every passage of the document keyed by id
     * @return found passages and dropped ids; never {@code null}
     * @throws NullPointerException if an argument is {@code null}
     */
    public ResolvedEvidence resolve(final List<Integer> citations, final Map<Integer, Chunk> chunksById) {
        Objects.requireNonNull(citations, "citations must not be null");
        Objects.requireNonNull(chunksById, "chunksById must not be null");

        final List<Chunk> found = new ArrayList<>(citations.size());
        final List<Integer> dropped = new ArrayList<>();
        for (final Integer id : citations) {
            final Chunk chunk = chunksById.get(id);
            if (chunk == null) {
                dropped.add(id);
            } else {
                found.add(chunk);
            }
        }
        return new ResolvedEvidence(found, dropped);
    }
}
