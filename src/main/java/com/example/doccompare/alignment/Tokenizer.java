package com.example.doccompare.alignment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a sentence into word-like runs and single punctuation characters.
 *
 * <p>A word-like run is a maximal sequence of word characters that may contain internal periods,
 * so decimals ({@code 3.00}) and abbreviations ({@code e.g}) stay together. A trailing period is
 * never part of a run. Whitespace separates tokens and is never emitted; any other character,
 * combining marks included, is a token of its own.
 */
public final class Tokenizer {
    // letters, numbers (½ and ² included) and underscore
    private static final String WORD = "\\p{L}\\p{N}_";
    private static final String SPACE = "\\p{IsWhite_Space}\\x{1C}-\\x{1F}";
    private static final String WORD_RUN =
            "(?<![" + WORD + "])[" + WORD + "]+[." + WORD + "]*"
                    + "(?<=[" + WORD + "])(?![" + WORD + "])";
    private static final Pattern TOKEN = Pattern.compile(WORD_RUN + "|[^" + WORD + SPACE + "]");

    public List<String> tokenize(String sentence) {
        List<String> tokens = new ArrayList<>();
        if (sentence == null || sentence.isEmpty()) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(sentence);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
