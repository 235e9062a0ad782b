package com.example.doccompare.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Elapsed time of each comparison step plus the overall duration.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonTiming {
    private List<Step> steps;
    private double totalDurationSeconds;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Step {
        private String label;
        private double durationSeconds;
    }
}
