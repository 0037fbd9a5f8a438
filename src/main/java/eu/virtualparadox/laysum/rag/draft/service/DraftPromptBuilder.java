package eu.virtualparadox.laysum.rag.draft.service;

import eu.virtualparadox.laysum.application.config.ApplicationConfig;
import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.capability.GenerationMessage;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the single generation request of a draft: a fixed system instruction (audience, tone,
 * strict JSON schema and structural rules) and a user message with the abstract, the evidence pool
 * and the requested mode.
 */
@Component
@RequiredArgsConstructor
public class DraftPromptBuilder {

    static final String INSTRUCTIONS = String.join("\n",
            "You are a helpful assistant that converts technical abstracts and passages into lay summaries",
            "for an informed general audience (science journalists, policymakers, interested non-specialists).",
            "Make the paper understandable, accurate, and concise. Avoid jargon unless strictly necessary.",
            "",
            "Output format (strict JSON, nothing else):",
            "",
            "{",
            "  \"mode\": \"micro\" | \"extended\",",
            "  \"lay_summary\": \"...\",",
            "  \"headline\": \"...\",",
            "  \"keywords\": [\"...\", \"...\"],",
            "  \"jargon_definitions\": { \"term\": \"short plain explanation\" },",
            "  \"sentences\": [",
            "    { \"text\": \"first sentence\", \"citations\": [chunk_id, ...] }",
            "  ]",
            "}",
            "",
            "Rules:",
            "1. Audience: informed layperson. Neutral tone, no marketing language, no equations.",
            "2. Structure:",
            "   - micro: exactly 3 sentences (the problem; what they did and found; why it matters).",
            "   - extended: 5 paragraphs (background; how the study worked; what they found;",
            "     why it matters; limitations and next steps), paragraphs separated by a blank line.",
            "3. Length: micro at most 200 words in total; extended at most 350 words in total.",
            "4. Veracity: only use facts supported by the evidence pool. Do not invent numbers.",
            "5. Every sentence must cite at least one chunk_id from the evidence pool.",
            "6. Jargon: keep it minimal; define every term you keep in jargon_definitions.",
            "7. Be specific about this paper; the summary must not fit any random paper."
    );

    private final ApplicationConfig config;

    /**
     * @param mode             requested summary shape
     * @param documentAbstract leading part of the document
     * @param evidence         ranked passages, most relevant first
     * @return system and user messages of the draft request
     */
    public List<GenerationMessage> build(final SummaryMode mode,
                                         final String documentAbstract,
                                         final List<Chunk> evidence) {
        final ApplicationConfig.Composer composer = config.getComposer();

        final StringBuilder user = new StringBuilder("Abstract & snippets:\n\"\"\"");
        user.append(StringUtils.left(documentAbstract, composer.getPromptAbstractChars())).append("\"\"\"\n\n");

        user.append("Relevant evidence pool (chunk_id -> passage):\n");
        for (final Chunk chunk : evidence) {
            user.append('[').append(chunk.id()).append("] ")
                    .append(StringUtils.left(chunk.text(), composer.getPassageChars()))
                    .append('\n');
        }

        user.append("\nProduce the lay summary and auxiliary outputs exactly as described.\n");
        user.append("Mode: ").append(mode.wireName()).append('\n');

        return List.of(GenerationMessage.system(INSTRUCTIONS), GenerationMessage.user(user.toString()));
    }
}
