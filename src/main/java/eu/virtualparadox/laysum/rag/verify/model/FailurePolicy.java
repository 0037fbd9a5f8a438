package eu.virtualparadox.laysum.rag.verify.model;

/**
 * What the verifier does when the entailment or rewrite capability fails for a sentence.
 * In both cases the remaining sentences are still verified.
 */
public enum FailurePolicy {
    /**
     * Keep the sentence as drafted, mark it {@link VerificationState#UNCHECKED} and record the failure.
     */
    FLAG,
    /**
     * Throw a {@link eu.virtualparadox.laysum.error.VerificationException} naming the first failing sentence.
     */
    FAIL
}
