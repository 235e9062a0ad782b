package com.example.doccompare.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Holds the rows of a sentence comparison together with its summary and timings.
 */
@Getter
@Setter
@NoArgsConstructor
public class ComparisonResult {
    private List<MatchPair> rows;
    private ComparisonSummary summary;
    private ComparisonTiming timing;
    private int leftSentenceCount;
    private int rightSentenceCount;
    private double threshold;

    public ComparisonResult(
            List<MatchPair> rows, int leftSentenceCount, int rightSentenceCount, double threshold) {
        this.rows = rows;
        this.summary = ComparisonSummary.of(rows);
        this.leftSentenceCount = leftSentenceCount;
        this.rightSentenceCount = rightSentenceCount;
        this.threshold = threshold;
        this.timing = null;
    }
}
