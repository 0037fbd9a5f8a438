package eu.virtualparadox.laysum.rag.capability;

/**
 * Judges whether evidence fully supports a claim.
 */
@FunctionalInterface
public interface EntailmentCapability {

    Verdict entails(String evidence, String claim);
}
