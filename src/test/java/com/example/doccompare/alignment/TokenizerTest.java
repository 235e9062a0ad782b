package com.example.doccompare.alignment;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    void splitsWordsAndTrailingPunctuation() {
        assertEquals(List.of("The", "cat", "sat", "."), tokenizer.tokenize("The cat sat."));
    }

    @Test
    void keepsDecimalsAndAbbreviationsTogether() {
        assertEquals(
                List.of("U.S", ".", "sales", "rose", "4.5", "%", "(", "e.g", ".", "Q1", ")", "."),
                tokenizer.tokenize("U.S. sales rose 4.5% (e.g. Q1)."));
    }

    @Test
    void everyPunctuationCharacterIsItsOwnToken() {
        assertEquals(
                List.of("It", "'", "s", "$", "1", ",", "000.50", "-", "-", "done", "!"),
                tokenizer.tokenize("It's $1,000.50 -- done!"));
        assertEquals(List.of("end", ".", ".", "."), tokenizer.tokenize("end..."));
    }

    @Test
    void treatsUnicodeLettersAndUnderscoresAsWordCharacters() {
        assertEquals(
                List.of("snake_case", "and", "naïve", "café"),
                tokenizer.tokenize("snake_case and naïve café"));
    }

    @Test
    void combiningMarksStandAlone() {
        assertEquals(List.of("cafe", "\u0301", "x"), tokenizer.tokenize("cafe\u0301 x"));
        assertEquals(List.of("n", "\u0303", "o"), tokenizer.tokenize("n\u0303o"));
    }

    @Test
    void numericSymbolsStayInsideWords() {
        assertEquals(List.of("1\u00bd", "cups"), tokenizer.tokenize("1\u00bd cups"));
        assertEquals(List.of("m\u00b2", "=", "4.5\u00b2"), tokenizer.tokenize("m\u00b2 = 4.5\u00b2"));
    }

    @Test
    void informationSeparatorsAreWhitespace() {
        assertEquals(List.of("a", "b"), tokenizer.tokenize("a\u001fb"));
    }

    @Test
    void emptyAndBlankSentencesHaveNoTokens() {
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   \t ").isEmpty());
    }

    @Test
    void tokenizingTwiceGivesTheSameTokens() {
        String sentence = "Revenue was 3.0 million, up 12% on 2023.";
        assertEquals(tokenizer.tokenize(sentence), tokenizer.tokenize(sentence));
    }
}
