package com.example.doccompare.domain;

/**
 * Classification of a single span in a compared sentence pair.
 */
public enum TokenClass {
    EQUAL(""),
    CASE_DIFF("case-diff"),
    DECIMAL_DIFF("decimal-diff"),
    DIFF("diff"),
    MISSING("missing"),
    EXTRA("extra");

    private final String cssClass;

    TokenClass(String cssClass) {
        this.cssClass = cssClass;
    }

    /** Style hook used by the renderers; empty for {@link #EQUAL}. */
    public String cssClass() {
        return cssClass;
    }

    public boolean isMarked() {
        return this != EQUAL;
    }
}
