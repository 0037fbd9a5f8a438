package eu.virtualparadox.laysum.rag.capability;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Claim repair by the language model: one short claim, supported by the evidence only.
 */
@Service
@RequiredArgsConstructor
public class LlmRewriteCapability implements RewriteCapability {

    static final String SYSTEM_PROMPT =
            "Rewrite the claim to be fully supported by the evidence. Keep it short and accurate.";

    private final GenerationCapability generationCapability;

    @Override
    public String rewrite(final String evidence, final String claim) {
        final String user = "Evidence:\n" + evidence + "\n\nClaim:\n" + claim + "\n\nRewrite:";
        return generationCapability.generate(
                List.of(GenerationMessage.system(SYSTEM_PROMPT), GenerationMessage.user(user)),
                0.1,
                120);
    }
}
