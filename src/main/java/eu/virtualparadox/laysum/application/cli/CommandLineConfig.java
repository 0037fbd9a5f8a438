package eu.virtualparadox.laysum.application.cli;

import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.summary.json.PayloadJsonWriter;
import eu.virtualparadox.laysum.summary.model.Payload;
import eu.virtualparadox.laysum.summary.pipeline.SummaryPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Summarizes a text file on startup and prints the payload JSON to standard output.
 * <p>Enabled by {@code laysum.cli.input=<path>}; {@code laysum.cli.mode} and
 * {@code laysum.cli.language} are optional.</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "laysum.cli", name = "input")
@RequiredArgsConstructor
@Slf4j
public class CommandLineConfig {

    private final SummaryPipeline summaryPipeline;
    private final PayloadJsonWriter payloadJsonWriter;

    @Bean
    public ApplicationRunner summarizeFileRunner(@Value("${laysum.cli.input}") final String input,
                                                 @Value("${laysum.cli.mode:micro}") final String mode,
                                                 @Value("${laysum.cli.language:}") final String language) {
        return args -> {
            final SummaryMode summaryMode = SummaryMode.fromWireName(mode)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "laysum.cli.mode must be micro or extended, got '" + mode + "'"));
            final Path path = Path.of(input);
            final String text = readText(path);
            log.info("Summarizing {} ({} chars, {})", path, text.length(), summaryMode.wireName());

            final Payload payload = summaryPipeline.summarize(
                    path.getFileName().toString(), text, summaryMode, StringUtils.trimToNull(language));
            System.out.println(payloadJsonWriter.writePretty(payload));
        };
    }

    private static String readText(final Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read input file " + path, e);
        }
    }
}
