package eu.virtualparadox.laysum.summary.readability;

import eu.virtualparadox.laysum.summary.model.ReadingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flesch readability of English prose.
 * <pre>
 *   grade = 0.39 * (words / sentences) + 11.8 * (syllables / words) - 15.59
 *   ease  = 206.835 - 1.015 * (words / sentences) - 84.6 * (syllables / words)
 * </pre>
 * Both values are rounded to two decimals. Syllables are estimated with a vowel-group heuristic.
 * Never throws: text without words, or any failure, yields {@link ReadingMetrics#UNAVAILABLE}.
 */
@Component
@Slf4j
public class ReadabilityCalculator {

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}'’-]*");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]{1,2}");
    private static final Pattern SILENT_SUFFIX = Pattern.compile("(?:[^laeiouy]es|ed|[^laeiouy]e)$");

    public ReadingMetrics compute(final String text) {
        if (text == null || text.isBlank()) {
            return ReadingMetrics.UNAVAILABLE;
        }
        try {
            int words = 0;
            int syllables = 0;
            final Matcher matcher = WORD.matcher(text);
            while (matcher.find()) {
                words++;
                syllables += countSyllables(matcher.group());
            }
            if (words == 0) {
                return ReadingMetrics.UNAVAILABLE;
            }

            final int sentences = countSentences(text);
            final double wordsPerSentence = (double) words / sentences;
            final double syllablesPerWord = (double) syllables / words;

            final double grade = 0.39 * wordsPerSentence + 11.8 * syllablesPerWord - 15.59;
            final double ease = 206.835 - 1.015 * wordsPerSentence - 84.6 * syllablesPerWord;
            return new ReadingMetrics(round2(grade), round2(ease));
        } catch (RuntimeException e) {
            log.warn("Readability could not be computed, using sentinel values", e);
            return ReadingMetrics.UNAVAILABLE;
        }
    }

    /**
     * Number of sentences: pieces between terminator runs that contain a word. At least one.
     */
    static int countSentences(final String text) {
        int sentences = 0;
        for (final String piece : SENTENCE_END.split(text)) {
            if (WORD.matcher(piece).find()) {
                sentences++;
            }
        }
        return Math.max(1, sentences);
    }

    /**
     * Estimated syllables of one word; numbers and words of up to three letters count as one.
     */
    static int countSyllables(final String word) {
        String letters = word.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        if (letters.length() <= 3) {
            return 1;
        }
        letters = SILENT_SUFFIX.matcher(letters).replaceFirst("");
        letters = letters.replaceFirst("^y", "");

        int groups = 0;
        final Matcher matcher = VOWEL_GROUP.matcher(letters);
        while (matcher.find()) {
            groups++;
        }
        return Math.max(1, groups);
    }

    private static double round2(final double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
