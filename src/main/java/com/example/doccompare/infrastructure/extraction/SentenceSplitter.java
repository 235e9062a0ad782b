package com.example.doccompare.infrastructure.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits running text into sentences.
 *
 * <p>A boundary is whitespace that follows {@code .}, {@code !} or {@code ?} and precedes an
 * uppercase ASCII letter. The boundary whitespace is dropped; pieces are trimmed and blank pieces
 * discarded.
 */
public final class SentenceSplitter {
    private static final Pattern BOUNDARY =
            Pattern.compile("(?<=[.!?])\\s+(?=[A-Z])", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE =
            Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private SentenceSplitter() {}

    public static List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return sentences;
        }
        for (String piece : BOUNDARY.split(text)) {
            String sentence = trim(piece);
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }

    /** Trims all Unicode whitespace, including non-breaking spaces. */
    public static String trim(String value) {
        return EDGE_WHITESPACE.matcher(value).replaceAll("");
    }
}
