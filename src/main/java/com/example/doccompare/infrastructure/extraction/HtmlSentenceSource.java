package com.example.doccompare.infrastructure.extraction;

import com.example.doccompare.application.SentenceSource;
import com.example.doccompare.domain.DocumentExtractionException;
import com.example.doccompare.domain.DocumentFormat;
import com.example.doccompare.domain.DocumentInput;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the visible text of an HTML page. Page chrome (scripts, styles, header, footer and
 * navigation) is removed before the text is collected.
 */
@Component
public class HtmlSentenceSource implements SentenceSource {
    static final String HIDDEN_ELEMENTS = "script, style, noscript, header, footer, nav";

    @Override
    public DocumentFormat format() {
        return DocumentFormat.HTML;
    }

    @Override
    public List<String> extractSentences(DocumentInput document) throws IOException {
        Document html;
        try (InputStream inputStream = document.openStream()) {
            html = Jsoup.parse(inputStream, "UTF-8", "");
        } catch (IOException e) {
            throw new DocumentExtractionException(document.filename(), "Failed to read HTML", e);
        }
        return SentenceSplitter.split(visibleText(html));
    }

    String visibleText(Document html) {
        html.select(HIDDEN_ELEMENTS).remove();
        List<String> textNodes = new ArrayList<>();
        NodeTraversor.traverse(
                (node, depth) -> {
                    if (node instanceof TextNode textNode) {
                        textNodes.add(textNode.getWholeText());
                    }
                },
                html);

        List<String> lines = new ArrayList<>();
        for (String line : String.join("\n", textNodes).split("\\R")) {
            String trimmed = SentenceSplitter.trim(line);
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return String.join(" ", lines);
    }
}
