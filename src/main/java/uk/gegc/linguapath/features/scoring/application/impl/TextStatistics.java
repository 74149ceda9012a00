package uk.gegc.linguapath.features.scoring.application.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word, sentence and paragraph counting shared by the text scorers.
 */
final class TextStatistics {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern PUNCTUATION = Pattern.compile("[.!?:;,]");

    private TextStatistics() {
    }

    static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }

    /**
     * Lower-cases, strips punctuation and splits on whitespace.
     */
    static List<String> normalizedTokens(String text) {
        String cleaned = NON_WORD.matcher(nullToEmpty(text).toLowerCase(Locale.ROOT)).replaceAll("");
        return Arrays.stream(WHITESPACE.split(cleaned))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    static int wordCount(String text) {
        String trimmed = nullToEmpty(text).trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    static int sentenceCount(String text) {
        return (int) Arrays.stream(SENTENCE_END.split(nullToEmpty(text)))
                .filter(segment -> !segment.isBlank())
                .count();
    }

    static int paragraphCount(String text) {
        String unified = nullToEmpty(text).replace("\r\n", "\n");
        return (int) Arrays.stream(BLANK_LINE.split(unified))
                .filter(paragraph -> !paragraph.isBlank())
                .count();
    }

    static List<String> lowerCaseWords(String text) {
        Matcher matcher = WORD.matcher(nullToEmpty(text).toLowerCase(Locale.ROOT));
        List<String> words = new ArrayList<>();
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    static int punctuationCount(String text) {
        return countMatches(PUNCTUATION, text);
    }

    static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(nullToEmpty(text));
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
