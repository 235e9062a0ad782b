package com.example.doccompare.domain;

import java.util.Objects;

/** Source document and its rendering, joined on a shared key. */
public record DocumentPair(String key, DocumentInput left, DocumentInput right) {
    public DocumentPair {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
