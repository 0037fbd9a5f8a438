package eu.virtualparadox.laysum.summary.pipeline;

import eu.virtualparadox.laysum.application.config.ApplicationConfig;
import eu.virtualparadox.laysum.ingest.chunker.Chunker;
import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.capability.EntailmentCapability;
import eu.virtualparadox.laysum.rag.capability.GenerationCapability;
import eu.virtualparadox.laysum.rag.capability.RewriteCapability;
import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.DraftContext;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.rag.draft.service.DraftComposer;
import eu.virtualparadox.laysum.rag.draft.service.DraftShapeChecker;
import eu.virtualparadox.laysum.rag.rank.model.ScoredChunk;
import eu.virtualparadox.laysum.rag.rank.service.RelevanceRanker;
import eu.virtualparadox.laysum.rag.verify.service.EvidenceVerifier;
import eu.virtualparadox.laysum.summary.finalize.Finalizer;
import eu.virtualparadox.laysum.summary.model.Payload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Turns the extracted text of one document into a verified lay summary.
 * <p>
 * chunk, rank against the abstract, draft, shape check, verify, finalize. Each run is
 * independent; nothing is kept between documents.
 * </p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryPipeline {

    private final ApplicationConfig config;
    private final Chunker chunker;
    private final RelevanceRanker relevanceRanker;
    private final DraftComposer draftComposer;
    private final DraftShapeChecker draftShapeChecker;
    private final EvidenceVerifier evidenceVerifier;
    private final Finalizer finalizer;
    private final GenerationCapability generationCapability;
    private final EntailmentCapability entailmentCapability;
    private final RewriteCapability rewriteCapability;

    public Payload summarize(final String documentId,
                             final String text,
                             final SummaryMode mode,
                             final String language) {
        return summarize(documentId, text, mode, language, stage -> { });
    }

    /**
     * @param documentId id of the document, used in logs and errors
     * @param text       extracted document text
     * @param mode       requested summary shape
     * @param language   payload language, the configured default when blank
     * @param onStage    notified before each stage starts
     * @return the finished payload
     * @throws eu.virtualparadox.laysum.error.LaySummaryException if a stage fails
     */
    public Payload summarize(final String documentId,
                             final String text,
                             final SummaryMode mode,
                             final String language,
                             final Consumer<PipelineStage> onStage) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(onStage, "onStage must not be null");

        onStage.accept(PipelineStage.CHUNKING);
        final List<Chunk> chunks = chunker.chunk(text);
        final Map<Integer, Chunk> chunksById = chunks.stream()
                .collect(Collectors.toMap(Chunk::id, c -> c, (a, b) -> a, LinkedHashMap::new));
        log.info("Document {} split into {} chunks", documentId, chunks.size());

        onStage.accept(PipelineStage.RANKING);
        final String documentAbstract = StringUtils.left(text, config.getAbstractChars());
        final List<ScoredChunk> scored = relevanceRanker.score(chunks, documentAbstract);
        printDebugScored(documentId, scored);
        final List<Chunk> evidence = scored.stream()
                .limit(config.getEvidenceTopK())
                .map(ScoredChunk::chunk)
                .toList();

        onStage.accept(PipelineStage.DRAFTING);
        final DraftContext context = draftComposer.compose(
                documentId, mode, documentAbstract, evidence, generationCapability);
        final Set<Integer> evidenceIds = evidence.stream().map(Chunk::id).collect(Collectors.toSet());
        final List<String> violations = draftShapeChecker.check(context.draft(), evidenceIds);
        violations.forEach(v -> log.warn("Draft for {} breaks shape rule: {}", documentId, v));

        onStage.accept(PipelineStage.VERIFYING);
        final Draft checked = evidenceVerifier.verify(
                documentId, context.draft(), chunksById, entailmentCapability, rewriteCapability);

        onStage.accept(PipelineStage.FINALIZING);
        final Payload payload = finalizer.finalizeDraft(
                checked, context.reading(), context.disclaimers(), chunksById, language);
        log.info("Summary for {} finished: {} sentences, language {}",
                documentId, payload.sentences().size(), payload.language());
        return payload;
    }

    private void printDebugScored(final String documentId, final List<ScoredChunk> scored) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final ScoredChunk s : scored) {
            sb.append(" - [").append(s.score()).append("] #").append(s.chunk().id()).append(' ')
                    .append(StringUtils.abbreviate(s.chunk().text(), 120)).append("\n");
        }
        log.debug(" !!! Ranked chunks for {}:\n{}", documentId, sb);
    }
}
