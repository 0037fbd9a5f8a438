package eu.virtualparadox.laysum.summary.finalize;

import eu.virtualparadox.laysum.application.config.ApplicationConfig;
import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.SentenceClaim;
import eu.virtualparadox.laysum.summary.model.EvidenceSpan;
import eu.virtualparadox.laysum.summary.model.Payload;
import eu.virtualparadox.laysum.summary.model.PayloadSentence;
import eu.virtualparadox.laysum.summary.model.ReadingMetrics;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles the payload from a checked draft. Makes no capability calls and cannot fail
 * on non-null input; the same input always yields an equal payload.
 */
@Component
@RequiredArgsConstructor
public class Finalizer {

    private final ApplicationConfig config;

    /**
     * Finalizes without source spans, in the configured default language.
     */
    public Payload finalizeDraft(final Draft checked,
                                 final ReadingMetrics reading,
                                 final List<String> disclaimers) {
        return finalizeDraft(checked, reading, disclaimers, Map.of(), null);
    }

    /**
     * @param checked     the verified draft
     * @param reading     readability of the lay summary
     * @param disclaimers disclaimers triggered by the abstract
     * @param chunksById  passages of the document, used to attach a span per citation
     * @param language    payload language, the configured default when blank
     */
    public Payload finalizeDraft(final Draft checked,
                                 final ReadingMetrics reading,
                                 final List<String> disclaimers,
                                 final Map<Integer, Chunk> chunksById,
                                 final String language) {
        Objects.requireNonNull(checked, "checked must not be null");
        Objects.requireNonNull(reading, "reading must not be null");
        Objects.requireNonNull(disclaimers, "disclaimers must not be null");
        Objects.requireNonNull(chunksById, "chunksById must not be null");

        final List<PayloadSentence> sentences = checked.sentences().stream()
                .map(s -> toPayloadSentence(s, chunksById))
                .toList();

        return new Payload(
                checked.mode(),
                checked.laySummary(),
                checked.headline(),
                checked.keywords(),
                checked.jargonDefinitions(),
                sentences,
                reading,
                disclaimers,
                StringUtils.defaultIfBlank(language, config.getDefaultLanguage()));
    }

    private static PayloadSentence toPayloadSentence(final SentenceClaim sentence,
                                                     final Map<Integer, Chunk> chunksById) {
        final List<EvidenceSpan> spans = sentence.citations().stream()
                .map(chunksById::get)
                .filter(Objects::nonNull)
                .map(EvidenceSpan::of)
                .toList();
        return new PayloadSentence(sentence.text(), sentence.citations(), spans);
    }
}
