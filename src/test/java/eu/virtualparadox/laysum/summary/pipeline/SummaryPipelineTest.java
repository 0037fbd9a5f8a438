package eu.virtualparadox.laysum.summary.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.laysum.application.config.ApplicationConfig;
import eu.virtualparadox.laysum.application.executor.CapabilityExecutor;
import eu.virtualparadox.laysum.application.executor.VerificationExecutor;
import eu.virtualparadox.laysum.error.GenerationException;
import eu.virtualparadox.laysum.ingest.chunker.Chunker;
import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.capability.CapabilityInvoker;
import eu.virtualparadox.laysum.rag.capability.EntailmentCapability;
import eu.virtualparadox.laysum.rag.capability.GenerationCapability;
import eu.virtualparadox.laysum.rag.capability.RewriteCapability;
import eu.virtualparadox.laysum.rag.capability.Verdict;
import eu.virtualparadox.laysum.rag.draft.model.SummaryMode;
import eu.virtualparadox.laysum.rag.draft.service.DraftComposer;
import eu.virtualparadox.laysum.rag.draft.service.DraftParser;
import eu.virtualparadox.laysum.rag.draft.service.DraftPromptBuilder;
import eu.virtualparadox.laysum.rag.draft.service.DraftShapeChecker;
import eu.virtualparadox.laysum.rag.rank.analysis.AlphanumericAnalyzer;
import eu.virtualparadox.laysum.rag.rank.service.Bm25RelevanceRanker;
import eu.virtualparadox.laysum.rag.verify.citation.CitationResolver;
import eu.virtualparadox.laysum.rag.verify.service.EvidenceVerifier;
import eu.virtualparadox.laysum.summary.disclaimer.DisclaimerDetector;
import eu.virtualparadox.laysum.summary.finalize.Finalizer;
import eu.virtualparadox.laysum.summary.model.Payload;
import eu.virtualparadox.laysum.summary.model.PayloadSentence;
import eu.virtualparadox.laysum.summary.readability.ReadabilityCalculator;
import eu.virtualparadox.laysum.support.TestExecutors;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SummaryPipelineTest {

    private static final String DOCUMENT = String.join(" ",
            "We ran a randomized trial on how altitude changes the boiling point of water.",
            "Water boils at 100°C at sea level.",
            "At three thousand metres the boiling point dropped to about 90°C in every kettle we tested.",
            "Cooking times for pasta grew longer as the boiling point fell.",
            "Dissolved salt raised the boiling point by less than one degree.",
            "Mountain cooks should therefore expect slower cooking rather than rely on salt.",
            "Our kettles were consumer models and may not represent laboratory equipment.");

    private static final String DRAFT_JSON = """
            {"mode": "micro",
             "lay_summary": "generated prose",
             "headline": "Why pasta cooks slowly in the mountains",
             "keywords": ["boiling point", "altitude"],
             "jargon_definitions": {"boiling point": "temperature at which water turns to steam"},
             "sentences": [
               {"text": "Water boils at 100°C at sea level.", "citations": [0]},
               {"text": "Water boils at 50°C in the mountains.", "citations": [0, 99]},
               {"text": "Salt barely changes the boiling point.", "citations": [1]}
             ]}
            """;

    private Analyzer analyzer;
    private VerificationExecutor verificationExecutor;
    private CapabilityExecutor capabilityExecutor;
    private ApplicationConfig config;
    private Chunker chunker;

    private final List<String> prompts = new ArrayList<>();
    private final List<String> rewrites = new ArrayList<>();

    private final GenerationCapability generation = (messages, temperature, maxTokens) -> {
        prompts.add(messages.get(1).content());
        return "Here you go:\n" + DRAFT_JSON;
    };

    private final EntailmentCapability entailment = (evidence, claim) ->
            evidence.contains(claim) || claim.startsWith("Salt") ? Verdict.YES : Verdict.NO;

    private final RewriteCapability rewrite = (evidence, claim) -> {
        synchronized (rewrites) {
            rewrites.add(claim);
        }
        return "Water boils below 100°C at altitude.";
    };

    @BeforeEach
    void setUp() {
        analyzer = new AlphanumericAnalyzer();
        verificationExecutor = TestExecutors.verification(2);
        capabilityExecutor = TestExecutors.capability(3);
        config = new ApplicationConfig();
        config.setEvidenceTopK(3);
        chunker = new Chunker(200, 40);
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
        verificationExecutor.shutdown();
        capabilityExecutor.shutdown();
    }

    private SummaryPipeline pipeline(GenerationCapability generate) {
        CapabilityInvoker invoker = new CapabilityInvoker(capabilityExecutor, Duration.ofSeconds(5));
        DraftComposer composer = new DraftComposer(config, new DraftPromptBuilder(config),
                new DraftParser(new ObjectMapper()), invoker, new ReadabilityCalculator(), new DisclaimerDetector());
        EvidenceVerifier verifier = new EvidenceVerifier(verificationExecutor, invoker, new CitationResolver(), config);
        return new SummaryPipeline(config, chunker,
                new Bm25RelevanceRanker(analyzer, new BM25Similarity(1.5f, 0.75f)),
                composer, new DraftShapeChecker(), verifier, new Finalizer(config),
                generate, entailment, rewrite);
    }

    @Test
    @DisplayName("Text runs through every stage into a consistent, citation-checked payload")
    void endToEnd() {
        List<PipelineStage> stages = new ArrayList<>();

        Payload payload = pipeline(generation).summarize("kettles", DOCUMENT, SummaryMode.MICRO, null, stages::add);

        assertEquals(List.of(PipelineStage.values()), stages);
        assertEquals(1, prompts.size());
        assertEquals(List.of("Water boils at 50°C in the mountains."), rewrites);

        assertEquals(SummaryMode.MICRO, payload.mode());
        assertEquals("Why pasta cooks slowly in the mountains", payload.headline());
        assertThat(payload.sentences()).extracting(PayloadSentence::text).containsExactly(
                "Water boils at 100°C at sea level.",
                "Water boils below 100°C at altitude.",
                "Salt barely changes the boiling point.");
        assertEquals(payload.sentences().stream().map(PayloadSentence::text).collect(Collectors.joining(" ")),
                payload.laySummary());
        assertEquals(List.of("Health: Not medical advice."), payload.disclaimers());
        assertEquals("en", payload.language());
        assertTrue(payload.readingLevel().isAvailable());
    }

    @Test
    @DisplayName("Every citation in the payload names a passage of the document")
    void citationIntegrity() {
        Set<Integer> ids = chunker.chunk(DOCUMENT).stream().map(Chunk::id).collect(Collectors.toSet());

        Payload payload = pipeline(generation).summarize("kettles", DOCUMENT, SummaryMode.MICRO, "fr");

        for (PayloadSentence sentence : payload.sentences()) {
            assertThat(ids).containsAll(sentence.citations());
            assertEquals(sentence.citations().size(), sentence.spans().size());
        }
        assertEquals(List.of(0), payload.sentences().get(1).citations());
        assertEquals("fr", payload.language());
    }

    @Test
    @DisplayName("The prompt carries the top ranked passages only")
    void evidencePool() {
        pipeline(generation).summarize("kettles", DOCUMENT, SummaryMode.EXTENDED, null);

        String prompt = prompts.get(0);
        long evidenceLines = prompt.lines().filter(l -> l.matches("^\\[\\d+] .*")).count();
        assertEquals(3, evidenceLines);
        assertThat(prompt).endsWith("Mode: extended\n");
    }

    @Test
    @DisplayName("A generation failure aborts the run before verification")
    void generationFailure() {
        List<PipelineStage> stages = new ArrayList<>();
        GenerationCapability failing = (messages, temperature, maxTokens) -> {
            throw new IllegalStateException("503 Service Unavailable");
        };
        AtomicReference<Payload> result = new AtomicReference<>();

        GenerationException ex = assertThrows(GenerationException.class, () -> result.set(
                pipeline(failing).summarize("kettles", DOCUMENT, SummaryMode.MICRO, null, stages::add)));

        assertEquals("kettles", ex.getDocumentId());
        assertEquals(List.of(PipelineStage.CHUNKING, PipelineStage.RANKING, PipelineStage.DRAFTING), stages);
        assertNull(result.get());
        assertTrue(rewrites.isEmpty());
    }

    @Test
    @DisplayName("Empty text still yields a payload when the generator answers")
    void emptyText() {
        Payload payload = pipeline(generation).summarize("empty", "", SummaryMode.MICRO, null);

        assertThat(prompts.get(0)).doesNotContain("\n[0] ");
        assertTrue(payload.sentences().stream().allMatch(s -> s.citations().isEmpty()));
    }
}
