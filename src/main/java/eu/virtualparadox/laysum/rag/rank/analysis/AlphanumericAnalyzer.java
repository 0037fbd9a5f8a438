package eu.virtualparadox.laysum.rag.rank.analysis;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.miscellaneous.TruncateTokenFilter;
import org.apache.lucene.analysis.pattern.PatternTokenizer;

import java.util.regex.Pattern;

/**
 * Analyzer emitting maximal ASCII alphanumeric runs, lower-cased. No stemming, no stop words.
 * <p>{@code "Red-apples, 2x!"} yields {@code [red, apples, 2x]}.</p>
 * <p>Tokens longer than {@link #MAX_TOKEN_LENGTH} characters are cut to that prefix, so the index
 * never sees a term above Lucene's term size limit.</p>
 */
public final class AlphanumericAnalyzer extends Analyzer {

    public static final int MAX_TOKEN_LENGTH = 255;

    private static final Pattern TOKEN = Pattern.compile("[a-zA-Z0-9]+");

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer source = new PatternTokenizer(TOKEN, 0);
        final TokenStream lowerCased = new LowerCaseFilter(source);
        final TokenStream truncated = new TruncateTokenFilter(lowerCased, MAX_TOKEN_LENGTH);
        return new TokenStreamComponents(source, truncated);
    }
}
