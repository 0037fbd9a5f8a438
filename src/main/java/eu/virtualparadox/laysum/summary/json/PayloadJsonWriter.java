package eu.virtualparadox.laysum.summary.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.laysum.summary.model.Payload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Writes a {@link Payload} as JSON in the output contract's key order.
 */
@Component
@RequiredArgsConstructor
public class PayloadJsonWriter {

    private final ObjectMapper objectMapper;

    public String write(final Payload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload could not be serialized", e);
        }
    }

    public String writePretty(final Payload payload) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload could not be serialized", e);
        }
    }
}
