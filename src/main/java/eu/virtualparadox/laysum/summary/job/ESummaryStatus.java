package eu.virtualparadox.laysum.summary.job;

import eu.virtualparadox.laysum.summary.pipeline.PipelineStage;

public enum ESummaryStatus {
    QUEUED,
    CHUNKING,
    RANKING,
    DRAFTING,
    VERIFYING,
    FINALIZING,
    COMPLETED,
    FAILED;

    public static ESummaryStatus of(final PipelineStage stage) {
        return valueOf(stage.name());
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
