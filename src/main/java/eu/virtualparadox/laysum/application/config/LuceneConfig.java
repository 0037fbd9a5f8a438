package eu.virtualparadox.laysum.application.config;

import eu.virtualparadox.laysum.rag.rank.analysis.AlphanumericAnalyzer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.search.similarities.Similarity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Lucene resources shared by every ranking call (Analyzer, Similarity).
 * <p>Indexes themselves are per call and in memory; only the analyzer holds reusable state and is
 * closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Analyzer analyzer;

    /**
     * Provides the passage analyzer: lower-cased alphanumeric runs.
     *
     * @return {@link AlphanumericAnalyzer} instance
     */
    @Bean
    public Analyzer passageAnalyzer() {
        this.analyzer = new AlphanumericAnalyzer();
        return this.analyzer;
    }

    /**
     * Provides the BM25 similarity.
     *
     * @param k1 term frequency saturation
     * @param b  length normalization
     * @return {@link BM25Similarity}
     */
    @Bean
    public Similarity bm25Similarity(@Value("${ranker.k1:1.5}") final float k1,
                                     @Value("${ranker.b:0.75}") final float b) {
        log.info("BM25 similarity with k1={}, b={}", k1, b);
        return new BM25Similarity(k1, b);
    }

    @PreDestroy
    public void close() {
        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }
    }
}
