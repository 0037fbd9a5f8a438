package eu.virtualparadox.laysum.rag.capability;

import eu.virtualparadox.laysum.error.GenerationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link GenerationCapability} backed by a Spring AI {@link ChatModel}.
 * <p>This is the only class that talks to the model provider; the pipeline sees the capability
 * interface only.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatModelGenerationCapability implements GenerationCapability {

    private final ChatModel chatModel;

    @Override
    public String generate(final List<GenerationMessage> messages, final double temperature, final int maxTokens) {
        final List<Message> promptMessages = new ArrayList<>(messages.size());
        for (final GenerationMessage message : messages) {
            promptMessages.add(switch (message.role()) {
                case SYSTEM -> new SystemMessage(message.content());
                case USER -> new UserMessage(message.content());
            });
        }

        final ChatOptions options = ChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        final Prompt prompt = new Prompt(promptMessages, options);

        final ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException e) {
            throw new GenerationException(null, "Chat model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new GenerationException(null, "Chat model returned no result");
        }
        final String text = response.getResult().getOutput().getText();
        log.debug(" !!! Generated {} chars (temperature={}, maxTokens={})",
                text == null ? 0 : text.length(), temperature, maxTokens);
        return text == null ? "" : text;
    }
}
