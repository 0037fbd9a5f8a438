package eu.virtualparadox.laysum.rag.capability;

import java.util.List;

/**
 * Text generation by a language model.
 * <p>Implementations own the transport and any retry policy. Failures must surface as
 * {@link eu.virtualparadox.laysum.error.GenerationException}.</p>
 */
@FunctionalInterface
public interface GenerationCapability {

    /**
     * @param messages    ordered system/user messages
     * @param temperature sampling temperature
     * @param maxTokens   upper bound on generated tokens
     * @return raw generated text (never {@code null})
     */
    String generate(List<GenerationMessage> messages, double temperature, int maxTokens);
}
