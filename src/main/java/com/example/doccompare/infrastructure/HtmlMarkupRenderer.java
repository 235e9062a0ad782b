package com.example.doccompare.infrastructure;

import com.example.doccompare.application.MarkupRenderer;
import com.example.doccompare.domain.DiffSpan;
import com.example.doccompare.domain.MatchPair;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes comparison rows as HTML. Marked spans become {@code <span class="...">} elements,
 * equal spans are plain text, and spans of one side are separated by single spaces.
 */
@Component
public class HtmlMarkupRenderer implements MarkupRenderer {
    private static final String STYLE =
            "table{border-collapse:collapse;width:100%}"
                    + "td{border:1px solid #ccc;padding:4px;vertical-align:top;width:50%}"
                    + ".missing{background:#fdd}"
                    + ".extra{background:#dfd}"
                    + ".case-diff{background:#ffd}"
                    + ".decimal-diff{background:#def}"
                    + ".diff{background:#fcb}";

    @Override
    public String renderSide(List<DiffSpan> spans) {
        return spans.stream().map(this::renderSpan).collect(Collectors.joining(" "));
    }

    @Override
    public String renderPage(String name, List<MatchPair> rows) {
        String title = Entities.escape(name == null ? "" : name);
        StringBuilder page = new StringBuilder();
        page.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n")
                .append("<title>")
                .append(title)
                .append(" comparison</title>\n<style>")
                .append(STYLE)
                .append("</style>\n</head>\n<body>\n<h1>")
                .append(title)
                .append("</h1>\n<table>\n<tr><th>Source</th><th>Rendered</th></tr>\n");
        for (MatchPair row : rows) {
            page.append("<tr")
                    .append(row.unmatchedLeft() ? " class=\"unmatched\"" : "")
                    .append("><td>")
                    .append(renderSide(row.left()))
                    .append("</td><td>")
                    .append(renderSide(row.right()))
                    .append("</td></tr>\n");
        }
        page.append("</table>\n</body>\n</html>\n");
        return page.toString();
    }

    private String renderSpan(DiffSpan span) {
        String text = Entities.escape(span.text());
        if (!span.tokenClass().isMarked()) {
            return text;
        }
        return "<span class=\"" + span.tokenClass().cssClass() + "\">" + text + "</span>";
    }
}
