package eu.virtualparadox.laysum.summary.job;

import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.summary.model.Payload;

import java.time.Instant;

public class SummaryJob {
    private final long id;
    private final String documentId;
    private final SummaryMode mode;
    private final Instant createdAt;
    private volatile ESummaryStatus status;
    private volatile Payload payload;
    private volatile String error;

    public SummaryJob(long id, String documentId, SummaryMode mode) {
        this.id = id;
        this.documentId = documentId;
        this.mode = mode;
        this.status = ESummaryStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public String getDocumentId() { return documentId; }
    public SummaryMode getMode() { return mode; }
    public Instant getCreatedAt() { return createdAt; }
    public ESummaryStatus getStatus() { return status; }
    public Payload getPayload() { return payload; }
    public String getError() { return error; }

    void setStatus(ESummaryStatus status) { this.status = status; }
    void setPayload(Payload payload) { this.payload = payload; }
    void setError(String error) { this.error = error; }
}
