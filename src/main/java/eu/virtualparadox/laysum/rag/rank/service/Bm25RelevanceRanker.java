package eu.virtualparadox.laysum.rag.rank.service;

import eu.virtualparadox.laysum.ingest.model.Chunk;
import eu.virtualparadox.laysum.rag.rank.model.ScoredChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static eu.virtualparadox.laysum.util.LuceneConstants.FIELD_ORDINAL;
import static eu.virtualparadox.laysum.util.LuceneConstants.FIELD_TEXT;

/**
 * Lexical BM25 ranker over the passages of a single document.
 * <p>
 * Steps:
 * <ol>
 *   <li>Index every passage into a throw-away in-memory Lucene index</li>
 *   <li>Tokenize the query with the same analyzer; repeated tokens become boosted clauses</li>
 *   <li>Run the BM25 query and collect a score per passage (0 for non-matching passages)</li>
 *   <li>Stable sort by descending score</li>
 * </ol>
 * The index lives only for the duration of one call, so the ranker keeps no state between documents.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class Bm25RelevanceRanker implements RelevanceRanker {

    private final Analyzer passageAnalyzer;
    private final Similarity bm25Similarity;

    @Override
    public List<ScoredChunk> score(final List<Chunk> chunks, final String query) {
        Objects.requireNonNull(chunks, "chunks must not be null");
        Objects.requireNonNull(query, "query must not be null");

        if (chunks.isEmpty()) {
            return Collections.emptyList();
        }

        final float[] scores = new float[chunks.size()];
        final Map<String, Integer> queryTerms = termFrequencies(tokenize(query));
        if (queryTerms.isEmpty()) {
            log.debug("Query has no alphanumeric tokens, keeping document order for {} chunks", chunks.size());
        } else {
            scoreWithBm25(chunks, queryTerms, scores);
        }

        final List<Integer> order = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            order.add(i);
        }
        // List.sort is stable: ties keep document order
        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        final List<ScoredChunk> ranked = new ArrayList<>(order.size());
        for (final int i : order) {
            ranked.add(new ScoredChunk(chunks.get(i), scores[i]));
        }
        return ranked;
    }

    /**
     * Splits text into the analyzer's tokens.
     *
     * @param text any text
     * @return lower-cased alphanumeric tokens in order of appearance
     */
    public List<String> tokenize(final String text) {
        final List<String> tokens = new ArrayList<>();
        try (TokenStream stream = passageAnalyzer.tokenStream(FIELD_TEXT, text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to tokenize text", e);
        }
        return tokens;
    }

    private void scoreWithBm25(final List<Chunk> chunks,
                               final Map<String, Integer> queryTerms,
                               final float[] scores) {
        try (Directory directory = new ByteBuffersDirectory()) {
            final IndexWriterConfig cfg = new IndexWriterConfig(passageAnalyzer)
                    .setSimilarity(bm25Similarity)
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE);
            try (IndexWriter writer = new IndexWriter(directory, cfg)) {
                for (int i = 0; i < chunks.size(); i++) {
                    final Document doc = new Document();
                    doc.add(new StoredField(FIELD_ORDINAL, i));
                    doc.add(new TextField(FIELD_TEXT, chunks.get(i).text(), Field.Store.NO));
                    writer.addDocument(doc);
                }
            }

            try (DirectoryReader reader = DirectoryReader.open(directory)) {
                final IndexSearcher searcher = new IndexSearcher(reader);
                searcher.setSimilarity(bm25Similarity);

                final TopDocs topDocs = searcher.search(buildQuery(queryTerms), chunks.size());
                final StoredFields storedFields = searcher.storedFields();
                for (final ScoreDoc sd : topDocs.scoreDocs) {
                    final int ordinal = storedFields.document(sd.doc)
                            .getField(FIELD_ORDINAL)
                            .numericValue()
                            .intValue();
                    scores[ordinal] = sd.score;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("BM25 scoring failed over " + chunks.size() + " chunks", e);
        }
    }

    /**
     * One SHOULD clause per distinct term; a term repeated {@code n} times in the query is boosted
     * by {@code n}, which equals summing its BM25 contribution {@code n} times.
     */
    private Query buildQuery(final Map<String, Integer> queryTerms) {
        final int maxClauses = IndexSearcher.getMaxClauseCount();
        if (queryTerms.size() > maxClauses) {
            log.warn("Query has {} distinct terms, only the first {} are scored", queryTerms.size(), maxClauses);
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        int clauses = 0;
        for (final Map.Entry<String, Integer> entry : queryTerms.entrySet()) {
            if (clauses++ >= maxClauses) {
                break;
            }
            final Query termQuery = new TermQuery(new Term(FIELD_TEXT, entry.getKey()));
            final int occurrences = entry.getValue();
            builder.add(occurrences == 1 ? termQuery : new BoostQuery(termQuery, occurrences),
                    BooleanClause.Occur.SHOULD);
        }
        return builder.build();
    }

    private static Map<String, Integer> termFrequencies(final List<String> tokens) {
        final Map<String, Integer> frequencies = new LinkedHashMap<>();
        for (final String token : tokens) {
            frequencies.merge(token, 1, Integer::sum);
        }
        return frequencies;
    }
}
