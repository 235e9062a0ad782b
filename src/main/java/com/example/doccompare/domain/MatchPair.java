package com.example.doccompare.domain;

import java.util.List;

/**
 * One row of a comparison report.
 *
 * <p>A row is either an aligned sentence pair, a source sentence with no counterpart
 * ({@code unmatchedLeft} set, right side empty) or a rendered sentence with no counterpart
 * (left side empty).
 */
public record MatchPair(List<DiffSpan> left, List<DiffSpan> right, boolean unmatchedLeft) {
    public MatchPair {
        left = left == null ? List.of() : List.copyOf(left);
        right = right == null ? List.of() : List.copyOf(right);
    }

    public static MatchPair missing(String leftSentence) {
        return new MatchPair(List.of(new DiffSpan(leftSentence, TokenClass.MISSING)), List.of(), true);
    }

    public static MatchPair extra(String rightSentence) {
        return new MatchPair(List.of(), List.of(new DiffSpan(rightSentence, TokenClass.EXTRA)), false);
    }

    public boolean rightOnly() {
        return !unmatchedLeft && left.isEmpty() && !right.isEmpty();
    }
}
