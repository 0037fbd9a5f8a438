package eu.virtualparadox.laysum.summary.job;

import eu.virtualparadox.laysum.application.executor.SummaryExecutor;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.summary.model.Payload;
import eu.virtualparadox.laysum.summary.pipeline.SummaryPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs summaries in the background, one document at a time, and tracks their progress.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryJobManager {

    static final String FAILURE_MESSAGE = "Summary generation failed for this document";

    private final SummaryPipeline summaryPipeline;
    private final SummaryJobRegistry registry;
    private final SummaryExecutor summaryExecutor;

    public SummaryJob submit(final String documentId,
                             final String text,
                             final SummaryMode mode,
                             final String language) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        final SummaryJob job = registry.createJob(documentId, mode);
        try {
            summaryExecutor.submit(() -> process(job, text, language));
        } catch (TaskRejectedException ex) {
            log.error("Summary job {} for document {} could not be scheduled", job.getId(), documentId, ex);
            registry.fail(job.getId(), FAILURE_MESSAGE + ": job could not be scheduled");
            throw ex;
        }
        log.info("Summary job {} queued for document {} ({})", job.getId(), documentId, mode.wireName());
        return job;
    }

    private void process(final SummaryJob job, final String text, final String language) {
        try {
            final Payload payload = summaryPipeline.summarize(job.getDocumentId(), text, job.getMode(), language,
                    stage -> registry.updateStatus(job.getId(), ESummaryStatus.of(stage)));
            registry.complete(job.getId(), payload);
            log.info("Summary job {} completed", job.getId());
        } catch (Exception ex) {
            log.error("Summary job {} failed for document {}", job.getId(), job.getDocumentId(), ex);
            registry.fail(job.getId(), FAILURE_MESSAGE + ": " + ex.getMessage());
        }
    }

    public Optional<SummaryJob> getJob(final long jobId) {
        return registry.getJob(jobId);
    }
}
