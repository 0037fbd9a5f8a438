package eu.virtualparadox.laysum.summary.pipeline;

public enum PipelineStage {
    CHUNKING,
    RANKING,
    DRAFTING,
    VERIFYING,
    FINALIZING
}
