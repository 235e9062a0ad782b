package com.example.doccompare.alignment;

import com.example.doccompare.domain.DiffSpan;

import java.util.List;

/** Classified spans for both sides of one aligned sentence pair. */
public record TokenDiff(List<DiffSpan> left, List<DiffSpan> right) {
    public TokenDiff {
        left = List.copyOf(left);
        right = List.copyOf(right);
    }
}
