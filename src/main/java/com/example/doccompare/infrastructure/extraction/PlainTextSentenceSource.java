package com.example.doccompare.infrastructure.extraction;

import com.example.doccompare.application.SentenceSource;
import com.example.doccompare.domain.DocumentExtractionException;
import com.example.doccompare.domain.DocumentFormat;
import com.example.doccompare.domain.DocumentInput;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Component
public class PlainTextSentenceSource implements SentenceSource {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.TEXT;
    }

    @Override
    public List<String> extractSentences(DocumentInput document) throws IOException {
        String text;
        try (InputStream inputStream = document.openStream()) {
            text = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DocumentExtractionException(document.filename(), "Failed to read text", e);
        }
        return SentenceSplitter.split(text);
    }
}
