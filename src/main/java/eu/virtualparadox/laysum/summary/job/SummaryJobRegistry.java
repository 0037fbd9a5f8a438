package eu.virtualparadox.laysum.summary.job;

import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.summary.model.Payload;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory job store. Jobs are lost on restart.
 */
@Service
public class SummaryJobRegistry {

    private final AtomicLong counter;
    private final Map<Long, SummaryJob> jobs;

    public SummaryJobRegistry() {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
    }

    public SummaryJob createJob(String documentId, SummaryMode mode) {
        long id = counter.incrementAndGet();
        SummaryJob job = new SummaryJob(id, documentId, mode);
        jobs.put(id, job);
        return job;
    }

    public Optional<SummaryJob> getJob(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public void updateStatus(long id, ESummaryStatus status) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setStatus(status);
            return job;
        });
    }

    public void complete(long id, Payload payload) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setPayload(payload);
            job.setStatus(ESummaryStatus.COMPLETED);
            return job;
        });
    }

    public void fail(long id, String error) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setError(error);
            job.setStatus(ESummaryStatus.FAILED);
            return job;
        });
    }
}
