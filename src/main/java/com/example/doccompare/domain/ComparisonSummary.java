package com.example.doccompare.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Row and span counts of a comparison report.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonSummary {
    private int matched;
    private int missing;
    private int extra;
    private Map<TokenClass, Integer> spanCounts;

    public static ComparisonSummary of(List<MatchPair> rows) {
        int matched = 0;
        int missing = 0;
        int extra = 0;
        Map<TokenClass, Integer> counts = new EnumMap<>(TokenClass.class);
        for (TokenClass tokenClass : TokenClass.values()) {
            counts.put(tokenClass, 0);
        }
        for (MatchPair row : rows) {
            if (row.unmatchedLeft()) {
                missing++;
            } else if (row.rightOnly()) {
                extra++;
            } else {
                matched++;
            }
            row.left().forEach(span -> counts.merge(span.tokenClass(), 1, Integer::sum));
            row.right().forEach(span -> counts.merge(span.tokenClass(), 1, Integer::sum));
        }
        return new ComparisonSummary(matched, missing, extra, counts);
    }

    @JsonIgnore
    public boolean isIdentical() {
        return missing == 0
                && extra == 0
                && spanCounts != null
                && spanCounts.entrySet().stream()
                        .allMatch(e -> e.getKey() == TokenClass.EQUAL || e.getValue() == 0);
    }
}
