package com.example.doccompare.domain;

import java.util.Locale;
import java.util.Optional;

/** Document formats that can be turned into sentences. */
public enum DocumentFormat {
    DOCX("docx"),
    HTML("html", "htm"),
    TEXT("txt");

    private final String[] extensions;

    DocumentFormat(String... extensions) {
        this.extensions = extensions;
    }

    public static Optional<DocumentFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int lastSeparator = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        int lastDot = filename.lastIndexOf('.');
        if (lastDot <= lastSeparator) {
            return Optional.empty();
        }
        String extension = filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        for (DocumentFormat format : values()) {
            for (String candidate : format.extensions) {
                if (candidate.equals(extension)) {
                    return Optional.of(format);
                }
            }
        }
        return Optional.empty();
    }
}
