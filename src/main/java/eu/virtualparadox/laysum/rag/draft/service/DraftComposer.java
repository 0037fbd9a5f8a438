package eu.virtualparadox.laysum.rag.draft.service;

import eu.virtualparadox.laysum.application.config.ApplicationConfig;
import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.capability.CapabilityInvoker;
import eu.virtualparadox.laysum.rag.capability.GenerationCapability;
import eu.virtualparadox.laysum.rag.capability.GenerationMessage;
import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.DraftContext;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.summary.disclaimer.DisclaimerDetector;
import eu.virtualparadox.laysum.summary.model.ReadingMetrics;
import eu.virtualparadox.laysum.summary.readability.ReadabilityCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Produces the structured draft of a summary from one generation call.
 * <p>
 * Steps:
 * <ol>
 *   <li>Build the request from the abstract and the evidence pool ({@link DraftPromptBuilder})</li>
 *   <li>Call the generation capability once, bounded by the capability timeout</li>
 *   <li>Parse the output into a {@link Draft} ({@link DraftParser})</li>
 *   <li>Compute readability of the lay summary and the abstract's disclaimers</li>
 * </ol>
 * A failed generation or an unparseable output is fatal for the run and is not retried here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DraftComposer {

    private final ApplicationConfig config;
    private final DraftPromptBuilder draftPromptBuilder;
    private final DraftParser draftParser;
    private final CapabilityInvoker capabilityInvoker;
    private final ReadabilityCalculator readabilityCalculator;
    private final DisclaimerDetector disclaimerDetector;

    /**
     * @param documentId       document being summarized (error context)
     * @param mode             requested summary shape
     * @param documentAbstract leading part of the document
     * @param evidence         ranked passages, most relevant first
     * @param generate         generation capability
     * @return draft plus reading metrics and disclaimers
     * @throws eu.virtualparadox.laysum.error.GenerationException  if generation fails or times out
     * @throws eu.virtualparadox.laysum.error.DraftParseException if the output holds no JSON draft
     */
    public DraftContext compose(final String documentId,
                                final SummaryMode mode,
                                final String documentAbstract,
                                final List<Chunk> evidence,
                                final GenerationCapability generate) {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(documentAbstract, "documentAbstract must not be null");
        Objects.requireNonNull(evidence, "evidence must not be null");
        Objects.requireNonNull(generate, "generate must not be null");

        final List<GenerationMessage> messages = draftPromptBuilder.build(mode, documentAbstract, evidence);
        log.debug(" !!! Draft prompt for {}:\nSystem: {}\nUser: {}",
                documentId, messages.get(0).content(), messages.get(1).content());

        final ApplicationConfig.Composer composer = config.getComposer();
        final String raw = capabilityInvoker.call(documentId, "draft generation",
                () -> generate.generate(messages, composer.getTemperature(), composer.getMaxTokens()));
        log.debug(" !!! Raw draft for {}:\n{}", documentId, raw);

        final Draft draft = draftParser.parse(documentId, raw, mode);
        log.info("Draft for {} parsed: {} sentences, {} keywords", documentId,
                draft.sentences().size(), draft.keywords().size());

        final ReadingMetrics reading = readabilityCalculator.compute(draft.laySummary());
        final List<String> disclaimers = disclaimerDetector.detect(documentAbstract);
        return new DraftContext(draft, reading, disclaimers);
    }
}
