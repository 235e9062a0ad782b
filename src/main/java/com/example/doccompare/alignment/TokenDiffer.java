package com.example.doccompare.alignment;

import com.example.doccompare.domain.DiffSpan;
import com.example.doccompare.domain.TokenClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares two token sequences position by position.
 *
 * <p>There is no insertion or deletion recovery: token {@code i} on the left is only ever compared
 * with token {@code i} on the right. Positions beyond the shorter sequence are reported as
 * {@link TokenClass#MISSING} on the left or {@link TokenClass#EXTRA} on the right.
 */
public final class TokenDiffer {
    private final Tokenizer tokenizer;
    private final NumericNormalizer numericNormalizer;

    public TokenDiffer() {
        this(new Tokenizer(), new NumericNormalizer());
    }

    public TokenDiffer(Tokenizer tokenizer, NumericNormalizer numericNormalizer) {
        this.tokenizer = tokenizer;
        this.numericNormalizer = numericNormalizer;
    }

    public TokenDiff diff(String leftSentence, String rightSentence) {
        return diff(tokenizer.tokenize(leftSentence), tokenizer.tokenize(rightSentence));
    }

    public TokenDiff diff(List<String> leftTokens, List<String> rightTokens) {
        int length = Math.max(leftTokens.size(), rightTokens.size());
        List<DiffSpan> left = new ArrayList<>(leftTokens.size());
        List<DiffSpan> right = new ArrayList<>(rightTokens.size());
        for (int i = 0; i < length; i++) {
            String leftToken = i < leftTokens.size() ? leftTokens.get(i) : null;
            String rightToken = i < rightTokens.size() ? rightTokens.get(i) : null;
            if (leftToken == null) {
                right.add(new DiffSpan(rightToken, TokenClass.EXTRA));
                continue;
            }
            if (rightToken == null) {
                left.add(new DiffSpan(leftToken, TokenClass.MISSING));
                continue;
            }
            TokenClass tokenClass = classify(leftToken, rightToken);
            left.add(new DiffSpan(leftToken, tokenClass));
            right.add(new DiffSpan(rightToken, tokenClass));
        }
        return new TokenDiff(left, right);
    }

    /** Classifies two tokens occupying the same position. */
    public TokenClass classify(String leftToken, String rightToken) {
        if (leftToken.equals(rightToken)) {
            return TokenClass.EQUAL;
        }
        if (leftToken.toLowerCase(Locale.ROOT).equals(rightToken.toLowerCase(Locale.ROOT))) {
            return TokenClass.CASE_DIFF;
        }
        if (numericNormalizer.numericallyEqual(leftToken, rightToken)) {
            return TokenClass.DECIMAL_DIFF;
        }
        return TokenClass.DIFF;
    }
}
