package com.example.doccompare.domain;

import java.util.Objects;

/** A piece of sentence text together with its classification. */
public record DiffSpan(String text, TokenClass tokenClass) {
    public DiffSpan {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(tokenClass, "tokenClass");
    }

    public static DiffSpan equal(String text) {
        return new DiffSpan(text, TokenClass.EQUAL);
    }
}
