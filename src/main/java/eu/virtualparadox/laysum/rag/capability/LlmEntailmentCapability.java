package eu.virtualparadox.laysum.rag.capability;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entailment judged by the language model, constrained to a one-word answer.
 */
@Service
@RequiredArgsConstructor
public class LlmEntailmentCapability implements EntailmentCapability {

    static final String SYSTEM_PROMPT = "You are a careful scientific fact checker. Answer strictly YES or NO.";

    private final GenerationCapability generationCapability;

    @Override
    public Verdict entails(final String evidence, final String claim) {
        final String user = "Evidence:\n\"\"\"\n" + evidence + "\n\"\"\"\n"
                + "Claim:\n\"" + claim + "\"\n"
                + "Does the evidence fully entail the claim? Answer YES or NO only.";
        final String answer = generationCapability.generate(
                List.of(GenerationMessage.system(SYSTEM_PROMPT), GenerationMessage.user(user)),
                0.0,
                2);
        return Verdict.parse(answer);
    }
}
