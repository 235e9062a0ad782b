package com.example.doccompare.application;

import com.example.doccompare.alignment.SentenceAligner;
import com.example.doccompare.domain.ComparisonRequest;
import com.example.doccompare.domain.ComparisonResult;
import com.example.doccompare.domain.ComparisonTiming;
import com.example.doccompare.domain.DocumentExtractionException;
import com.example.doccompare.domain.DocumentFormat;
import com.example.doccompare.domain.DocumentInput;
import com.example.doccompare.domain.MatchPair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class ComparisonUseCase {
    private static final Logger log = LogManager.getLogger(ComparisonUseCase.class);

    private final Map<DocumentFormat, SentenceSource> sentenceSources;
    private final SentenceAligner sentenceAligner;

    public ComparisonUseCase(List<SentenceSource> sentenceSources, SentenceAligner sentenceAligner) {
        this.sentenceSources = new EnumMap<>(DocumentFormat.class);
        for (SentenceSource source : sentenceSources) {
            this.sentenceSources.put(source.format(), source);
        }
        this.sentenceAligner = sentenceAligner;
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(List<ComparisonTiming.Step> timings, String label, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        timings.add(new ComparisonTiming.Step(label, seconds));
        return seconds;
    }

    public ComparisonResult compare(ComparisonRequest request) throws IOException {
        SentenceAligner.validateThreshold(request.threshold());
        List<ComparisonTiming.Step> timings = new ArrayList<>();
        long overallStart = System.nanoTime();

        List<String> left = extract(request.left(), "left", timings);
        List<String> right = extract(request.right(), "right", timings);

        long alignStart = System.nanoTime();
        List<MatchPair> rows = sentenceAligner.align(left, right, request.threshold());
        double alignSeconds = recordStep(timings, "Align sentences", alignStart);
        log.info(
                "Aligned {} left and {} right sentences into {} rows in {}s",
                left.size(),
                right.size(),
                rows.size(),
                alignSeconds);

        ComparisonResult result =
                new ComparisonResult(rows, left.size(), right.size(), request.threshold());
        result.setTiming(
                new ComparisonTiming(
                        List.copyOf(timings), nanosToSeconds(System.nanoTime() - overallStart)));
        return result;
    }

    private List<String> extract(
            DocumentInput document, String label, List<ComparisonTiming.Step> timings)
            throws IOException {
        SentenceSource source = sourceFor(document);
        long start = System.nanoTime();
        List<String> sentences = source.extractSentences(document);
        double seconds = recordStep(timings, "Extract sentences (" + label + ")", start);
        log.info(
                "Extracted {} {} sentences from {} in {}s",
                sentences.size(),
                label,
                document.filename(),
                seconds);
        return sentences;
    }

    private SentenceSource sourceFor(DocumentInput document) throws DocumentExtractionException {
        DocumentFormat format =
                DocumentFormat.fromFilename(document.filename())
                        .orElseThrow(
                                () ->
                                        new DocumentExtractionException(
                                                document.filename(), "Unsupported document type"));
        SentenceSource source = sentenceSources.get(format);
        if (source == null) {
            throw new DocumentExtractionException(
                    document.filename(), "No sentence source registered for " + format);
        }
        return source;
    }
}
