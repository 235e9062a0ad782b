package com.example.doccompare.domain;

import java.io.IOException;

/** A document could not be read or turned into sentences. */
public class DocumentExtractionException extends IOException {
    private final String filename;

    public DocumentExtractionException(String filename, String message) {
        super(message + ": " + filename);
        this.filename = filename;
    }

    public DocumentExtractionException(String filename, String message, Throwable cause) {
        super(message + ": " + filename, cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
