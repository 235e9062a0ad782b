package com.example.doccompare.domain;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Represents an uploaded document in a framework-agnostic way.
 */
public class DocumentInput {
    private final String filename;
    private final InputStreamSupplier inputStreamSupplier;

    public DocumentInput(String filename, InputStreamSupplier inputStreamSupplier) {
        this.filename = filename != null ? filename : "";
        this.inputStreamSupplier = Objects.requireNonNull(inputStreamSupplier, "inputStreamSupplier");
    }

    public String filename() {
        return filename;
    }

    /** Filename without directories and without its last extension. */
    public String stem() {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String simple = slash >= 0 ? filename.substring(slash + 1) : filename;
        int dotIndex = simple.lastIndexOf('.');
        if (dotIndex <= 0) {
            return simple;
        }
        return simple.substring(0, dotIndex);
    }

    public InputStream openStream() throws IOException {
        return inputStreamSupplier.openStream();
    }

    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream openStream() throws IOException;
    }
}
