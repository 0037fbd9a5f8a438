package eu.virtualparadox.laysum.rag.capability;

/**
 * Binary entailment judgment.
 */
public enum Verdict {
    YES,
    NO;

    /**
     * Reads a model answer. Only an answer whose first token is {@code YES} (any case) counts as
     * {@link #YES}; empty, {@code null} or any other output is {@link #NO}, so an unclear answer
     * leads to a rewrite rather than to an unsupported claim being accepted.
     *
     * @param raw raw model output
     * @return the parsed verdict
     */
    public static Verdict parse(final String raw) {
        if (raw == null || raw.isBlank()) {
            return NO;
        }
        final String firstToken = raw.strip().split("\\s+")[0];
        return "YES".equalsIgnoreCase(firstToken) ? YES : NO;
    }
}
