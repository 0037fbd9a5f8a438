package eu.virtualparadox.laysum.rag.capability;

/**
 * Produces a replacement claim that is fully supported by the evidence.
 */
@FunctionalInterface
public interface RewriteCapability {

    /**
     * @return replacement claim text only
     */
    String rewrite(String evidence, String claim);
}
