package eu.virtualparadox.laysum.application.config;

import eu.virtualparadox.laysum.rag.verify.model.FailurePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Pipeline settings bound from {@code laysum.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "laysum")
@Getter @Setter
public class ApplicationConfig {

    /**
     * Upper bound for a single generation, entailment or rewrite call.
     */
    private Duration capabilityTimeout = Duration.ofSeconds(60);

    /**
     * Leading characters of the document used as its abstract (ranking query and prompt context).
     */
    private int abstractChars = 2000;

    /**
     * Number of ranked passages handed to the generator.
     */
    private int evidenceTopK = 6;

    private String defaultLanguage = "en";

    private Composer composer = new Composer();
    private Verifier verifier = new Verifier();

    @Getter @Setter
    public static class Composer {
        private int promptAbstractChars = 4000;
        private int passageChars = 800;
        private double temperature = 0.2;
        private int maxTokens = 1200;
    }

    @Getter @Setter
    public static class Verifier {
        private FailurePolicy failurePolicy = FailurePolicy.FLAG;
        private int concurrency = 4;
        private int summaryChars = 1200;
    }
}
