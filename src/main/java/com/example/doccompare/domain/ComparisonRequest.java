package com.example.doccompare.domain;

import java.util.Objects;

public record ComparisonRequest(DocumentInput left, DocumentInput right, double threshold) {
    public ComparisonRequest {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
