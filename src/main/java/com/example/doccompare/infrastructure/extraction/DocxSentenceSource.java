package com.example.doccompare.infrastructure.extraction;

import com.example.doccompare.application.SentenceSource;
import com.example.doccompare.domain.DocumentExtractionException;
import com.example.doccompare.domain.DocumentFormat;
import com.example.doccompare.domain.DocumentInput;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the body paragraphs of a Word document. Blank paragraphs are skipped and the rest are
 * joined line by line before sentence splitting.
 */
@Component
public class DocxSentenceSource implements SentenceSource {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.DOCX;
    }

    @Override
    public List<String> extractSentences(DocumentInput document) throws IOException {
        List<String> paragraphs = new ArrayList<>();
        try (InputStream inputStream = document.openStream();
                XWPFDocument docx = new XWPFDocument(inputStream)) {
            for (XWPFParagraph paragraph : docx.getParagraphs()) {
                String text = paragraph.getText();
                if (text != null && !SentenceSplitter.trim(text).isEmpty()) {
                    paragraphs.add(text);
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new DocumentExtractionException(document.filename(), "Failed to read DOCX", e);
        }
        return SentenceSplitter.split(String.join("\n", paragraphs));
    }
}
