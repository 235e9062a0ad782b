package com.example.doccompare.application;

import com.example.doccompare.domain.DiffSpan;
import com.example.doccompare.domain.MatchPair;

import java.util.List;

public interface MarkupRenderer {
    String renderSide(List<DiffSpan> spans);

    String renderPage(String name, List<MatchPair> rows);
}
