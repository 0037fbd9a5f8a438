package eu.virtualparadox.laysum.rag.draft.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.laysum.error.DraftParseException;
import eu.virtualparadox.laysum.rag.draft.model.Draft;
import eu.virtualparadox.laysum.rag.draft.model.SentenceClaim;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw generator output into a typed {@link Draft}.
 *
 * <h2>Decoding</h2>
 * <ol>
 *   <li>Decode the whole output as a JSON object.</li>
 *   <li>Otherwise decode the substring between the first {@code '{'} and the last {@code '}'}
 *       (the model wrapped the object in prose or a code fence).</li>
 *   <li>Otherwise fail with {@link DraftParseException} carrying the raw output.</li>
 * </ol>
 *
 * <h2>Defaults</h2>
 * Missing or mistyped fields fall back to empty values; blank sentences are skipped; citations may
 * be numbers or strings such as {@code "3"} or {@code "[3]"}, anything else is ignored. The mode is
 * always the requested one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DraftParser {

    private static final Pattern CITATION = Pattern.compile("^\\[?\\s*(\\d+)\\s*]?$");

    private final ObjectMapper objectMapper;

    /**
     * @param documentId    document being summarized (error context)
     * @param raw           generator output
     * @param requestedMode mode the draft was requested in
     * @return the parsed draft
     * @throws DraftParseException if no JSON object can be recovered
     */
    public Draft parse(final String documentId, final String raw, final SummaryMode requestedMode) {
        final JsonNode root = readObject(documentId, raw);

        final String declaredMode = text(root, "mode");
        final Optional<SummaryMode> parsedMode = SummaryMode.fromWireName(declaredMode);
        if (parsedMode.isPresent() && parsedMode.get() != requestedMode) {
            log.warn("Draft for {} declares mode '{}' but {} was requested, keeping the requested mode",
                    documentId, declaredMode, requestedMode.wireName());
        }

        return new Draft(
                requestedMode,
                text(root, "lay_summary"),
                text(root, "headline"),
                stringList(root, "keywords"),
                stringMap(root, "jargon_definitions"),
                sentences(root));
    }

    private JsonNode readObject(final String documentId, final String raw) {
        if (raw == null) {
            throw new DraftParseException(documentId, null, null);
        }

        JsonProcessingException firstFailure = null;
        try {
            final JsonNode node = objectMapper.readTree(raw);
            if (node != null && node.isObject()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            firstFailure = e;
        }

        final String extracted = extractJson(raw);
        if (extracted != null) {
            try {
                final JsonNode node = objectMapper.readTree(extracted);
                if (node != null && node.isObject()) {
                    log.debug("Recovered draft JSON for {} from noisy output ({} of {} chars)",
                            documentId, extracted.length(), raw.length());
                    return node;
                }
            } catch (JsonProcessingException e) {
                throw new DraftParseException(documentId, raw, e);
            }
        }
        throw new DraftParseException(documentId, raw, firstFailure);
    }

    private static String extractJson(final String text) {
        final int start = text.indexOf('{');
        final int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return null;
    }

    private static List<SentenceClaim> sentences(final JsonNode root) {
        final JsonNode node = root.get("sentences");
        if (node == null || !node.isArray()) {
            return Collections.emptyList();
        }

        final List<SentenceClaim> sentences = new ArrayList<>();
        for (final JsonNode item : node) {
            final String sentenceText;
            final List<Integer> citations;
            if (item.isTextual()) {
                sentenceText = item.asText().strip();
                citations = Collections.emptyList();
            } else if (item.isObject()) {
                sentenceText = text(item, "text").strip();
                citations = citations(item.get("citations"));
            } else {
                continue;
            }
            if (!sentenceText.isEmpty()) {
                sentences.add(new SentenceClaim(sentenceText, citations));
            }
        }
        return sentences;
    }

    private static List<Integer> citations(final JsonNode node) {
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            // a single citation not wrapped in an array
            final Integer single = citation(node);
            return single == null ? Collections.emptyList() : List.of(single);
        }
        final List<Integer> ids = new ArrayList<>();
        for (final JsonNode item : node) {
            final Integer id = citation(item);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static Integer citation(final JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            final int id = node.asInt();
            return id >= 0 ? id : null;
        }
        if (node.isFloatingPointNumber()) {
            final double value = node.asDouble();
            if (value >= 0 && value == Math.rint(value) && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return null;
        }
        if (node.isTextual()) {
            final Matcher matcher = CITATION.matcher(node.asText().strip());
            if (matcher.matches()) {
                try {
                    return Integer.valueOf(matcher.group(1));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode child = node.get(field);
        return (child != null && child.isTextual()) ? child.asText() : "";
    }

    private static List<String> stringList(final JsonNode node, final String field) {
        final JsonNode child = node.get(field);
        if (child == null || !child.isArray()) {
            return Collections.emptyList();
        }
        final List<String> result = new ArrayList<>();
        for (final JsonNode item : child) {
            if (item.isTextual() && !item.asText().isBlank()) {
                result.add(item.asText().strip());
            }
        }
        return result;
    }

    private static Map<String, String> stringMap(final JsonNode node, final String field) {
        final JsonNode child = node.get(field);
        if (child == null || !child.isObject()) {
            return Collections.emptyMap();
        }
        final Map<String, String> result = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = child.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isTextual()) {
                result.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return result;
    }
}
