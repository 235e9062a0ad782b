package com.example.doccompare.application;

import com.example.doccompare.domain.DocumentFormat;
import com.example.doccompare.domain.DocumentInput;

import java.io.IOException;
import java.util.List;

/**
 * Turns a document of one format into its ordered, trimmed sentences.
 */
public interface SentenceSource {
    DocumentFormat format();

    List<String> extractSentences(DocumentInput document) throws IOException;
}
