package eu.virtualparadox.laysum.rag.verify.service;

import eu.virtualparadox.laysum.application.config.ApplicationConfig;
import eu.virtualparadox.laysum.application.executor.VerificationExecutor;
import eu.virtualparadox.laysum.error.GenerationException;
import eu.virtualparadox.laysum.error.PipelineCancelledException;
import eu.virtualparadox.laysum.error.VerificationException;
import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.capability.CapabilityInvoker;
import eu.virtualparadox.laysum.rag.capability.EntailmentCapability;
import eu.virtualparadox.laysum.rag.capability.RewriteCapability;
import eu.virtualparadox.laysum.rag.capability.Verdict;
import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.SentenceClaim;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.rag.verify.citation.CitationResolver;
import eu.virtualparadox.laysum.rag.verify.citation.ResolvedEvidence;
import eu.virtualparadox.laysum.rag.verify.model.FailurePolicy;
import eu.virtualparadox.laysum.rag.verify.model.SentenceOutcome;
import eu.virtualparadox.laysum.rag.verify.model.VerificationReport;
import eu.virtualparadox.laysum.rag.verify.model.VerificationState;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Checks every sentence of a draft against the passages it cites and repairs unsupported ones.
 * <p>
 * Per sentence:
 * <ol>
 *   <li>Resolve the citations into evidence text; unknown ids are dropped from the sentence.</li>
 *   <li>Ask the entailment capability whether the evidence supports the sentence.</li>
 *   <li>On {@code YES} keep the sentence; on {@code NO} ask for exactly one rewrite and use it unchecked.</li>
 * </ol>
 * Sentences are checked concurrently on the {@link VerificationExecutor}. A micro draft gets its lay
 * summary rebuilt from the final sentences once every sentence is done.
 * </p>
 * <p>
 * A capability failure never stops the other sentences. What happens afterwards depends on the
 * {@link FailurePolicy}: {@code FLAG} keeps the drafted sentence and logs the failure,
 * {@code FAIL} throws the first {@link VerificationException}.
 * </p>
 */
@Service
@Slf4j
public class EvidenceVerifier {

    private final VerificationExecutor verificationExecutor;
    private final CapabilityInvoker capabilityInvoker;
    private final CitationResolver citationResolver;
    private final FailurePolicy failurePolicy;
    private final int summaryChars;

    @Autowired
    public EvidenceVerifier(final VerificationExecutor verificationExecutor,
                            final CapabilityInvoker capabilityInvoker,
                            final CitationResolver citationResolver,
                            final ApplicationConfig config) {
        this(verificationExecutor, capabilityInvoker, citationResolver,
                config.getVerifier().getFailurePolicy(), config.getVerifier().getSummaryChars());
    }

    public EvidenceVerifier(final VerificationExecutor verificationExecutor,
                            final CapabilityInvoker capabilityInvoker,
                            final CitationResolver citationResolver,
                            final FailurePolicy failurePolicy,
                            final int summaryChars) {
        this.verificationExecutor = Objects.requireNonNull(verificationExecutor, "verificationExecutor must not be null");
        this.capabilityInvoker = Objects.requireNonNull(capabilityInvoker, "capabilityInvoker must not be null");
        this.citationResolver = Objects.requireNonNull(citationResolver, "citationResolver must not be null");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
        if (summaryChars <= 0) {
            throw new IllegalArgumentException("summaryChars must be positive, got " + summaryChars);
        }
        this.summaryChars = summaryChars;
    }

    /**
     * Verifies {@code draft} and returns the checked copy. The input draft is not modified.
     *
     * @throws VerificationException       under {@link FailurePolicy#FAIL} if any sentence could not be checked
     * @throws PipelineCancelledException if the calling thread is interrupted
     */
    public Draft verify(final String documentId,
                        final Draft draft,
                        final Map<Integer, Chunk> chunksById,
                        final EntailmentCapability entails,
                        final RewriteCapability rewrite) {
        return verifyWithReport(documentId, draft, chunksById, entails, rewrite).draft();
    }

    /**
     * Same as {@link #verify}, also returning the per-sentence outcomes.
     */
    public VerificationReport verifyWithReport(final String documentId,
                                               final Draft draft,
                                               final Map<Integer, Chunk> chunksById,
                                               final EntailmentCapability entails,
                                               final RewriteCapability rewrite) {
        Objects.requireNonNull(draft, "draft must not be null");
        Objects.requireNonNull(chunksById, "chunksById must not be null");
        Objects.requireNonNull(entails, "entails must not be null");
        Objects.requireNonNull(rewrite, "rewrite must not be null");

        final List<SentenceClaim> sentences = draft.sentences();
        final List<Future<SentenceOutcome>> futures = new ArrayList<>(sentences.size());
        try {
            for (int i = 0; i < sentences.size(); i++) {
                final int index = i;
                final SentenceClaim sentence = sentences.get(i);
                futures.add(verificationExecutor.submit(
                        () -> verifySentence(documentId, index, sentence, chunksById, entails, rewrite)));
            }
        } catch (TaskRejectedException e) {
            futures.forEach(f -> f.cancel(true));
            throw new VerificationException(documentId, futures.size(), "could not be scheduled", e);
        }

        final List<SentenceOutcome> outcomes = new ArrayList<>(sentences.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(documentId, i, futures));
        }

        final VerificationReport report = new VerificationReport(assemble(draft, outcomes), outcomes);
        handleFailures(documentId, report);

        log.info("Verified {} sentences for {}: {} entailed, {} rewritten, {} unchecked", outcomes.size(), documentId,
                report.count(VerificationState.ENTAILED),
                report.count(VerificationState.REWRITTEN),
                report.count(VerificationState.UNCHECKED));
        return report;
    }

    private SentenceOutcome await(final String documentId,
                                  final int index,
                                  final List<Future<SentenceOutcome>> futures) {
        try {
            return futures.get(index).get();
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException(documentId, e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof PipelineCancelledException pce) {
                throw pce;
            }
            throw new VerificationException(documentId, index, "verification task failed", e.getCause());
        }
    }

    private SentenceOutcome verifySentence(final String documentId,
                                           final int index,
                                           final SentenceClaim sentence,
                                           final Map<Integer, Chunk> chunksById,
                                           final EntailmentCapability entails,
                                           final RewriteCapability rewrite) {
        final ResolvedEvidence evidence = citationResolver.resolve(sentence.citations(), chunksById);
        final SentenceClaim cited = sentence.withCitations(evidence.validIds());
        if (!evidence.droppedIds().isEmpty()) {
            log.warn("Sentence {} of {} cites unknown passages {}, dropping them",
                    index, documentId, evidence.droppedIds());
        }

        final String evidenceText = evidence.text();
        try {
            final Verdict verdict = capabilityInvoker.call(documentId, "entailment",
                    () -> entails.entails(evidenceText, cited.text()));
            if (verdict == Verdict.YES) {
                return SentenceOutcome.entailed(index, cited, evidence.droppedIds());
            }

            final String rewritten = capabilityInvoker.call(documentId, "rewrite",
                    () -> rewrite.rewrite(evidenceText, cited.text()));
            final String trimmed = StringUtils.strip(rewritten);
            if (StringUtils.isEmpty(trimmed)) {
                throw new GenerationException(documentId, "rewrite returned no text");
            }
            log.debug("Sentence {} of {} rewritten: '{}' -> '{}'", index, documentId, cited.text(), trimmed);
            return SentenceOutcome.rewritten(index, cited.withText(trimmed), evidence.droppedIds());
        } catch (GenerationException e) {
            return SentenceOutcome.failed(index, cited, evidence.droppedIds(),
                    new VerificationException(documentId, index, e.getMessage(), e));
        }
    }

    private Draft assemble(final Draft draft, final List<SentenceOutcome> outcomes) {
        final List<SentenceClaim> checked = outcomes.stream().map(SentenceOutcome::sentence).toList();
        final Draft result = draft.withSentences(checked);
        if (draft.mode() != SummaryMode.MICRO) {
            return result;
        }
        final List<String> texts = checked.stream().map(SentenceClaim::text).toList();
        return result.withLaySummary(truncateCodePoints(String.join(" ", texts), summaryChars));
    }

    /**
     * Keeps at most {@code maxCodePoints} code points, never splitting a surrogate pair.
     */
    static String truncateCodePoints(final String text, final int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    private void handleFailures(final String documentId, final VerificationReport report) {
        final List<SentenceOutcome> failures = report.failures();
        if (failures.isEmpty()) {
            return;
        }
        if (failurePolicy == FailurePolicy.FAIL) {
            final VerificationException first = failures.get(0).failure();
            failures.stream().skip(1).map(SentenceOutcome::failure).forEach(first::addSuppressed);
            throw first;
        }
        failures.forEach(f -> log.warn("Sentence {} of {} left unchecked: {}",
                f.index(), documentId, f.failure().getMessage()));
    }
}
