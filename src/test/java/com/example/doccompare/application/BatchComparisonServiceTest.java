package com.example.doccompare.application;

import com.example.doccompare.alignment.SentenceAligner;
import com.example.doccompare.domain.DocumentExtractionException;
import com.example.doccompare.domain.DocumentFormat;
import com.example.doccompare.domain.DocumentInput;
import com.example.doccompare.domain.DocumentPair;
import com.example.doccompare.domain.InvalidConfigurationException;
import com.example.doccompare.infrastructure.extraction.PlainTextSentenceSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchComparisonServiceTest {

    private final ComparisonUseCase useCase =
            new ComparisonUseCase(List.of(new PlainTextSentenceSource()), new SentenceAligner());
    private final BatchComparisonService service = new BatchComparisonService(useCase, 3);

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void returnsResultsInPairOrder() throws IOException {
        List<DocumentPair> pairs =
                List.of(
                        pair("a", "One sentence.", "One sentence."),
                        pair("b", "First. Second.", "First."),
                        pair("c", "", "Extra text."),
                        pair("d", "Same.", "Same."));

        List<BatchComparisonService.PairComparison> comparisons = service.compareAll(pairs, 0.3);

        assertThat(comparisons)
                .extracting(BatchComparisonService.PairComparison::key)
                .containsExactly("a", "b", "c", "d");
        assertEquals(1, comparisons.get(0).result().getSummary().getMatched());
        assertEquals(1, comparisons.get(1).result().getSummary().getMissing());
        assertEquals(1, comparisons.get(2).result().getSummary().getExtra());
    }

    @Test
    void emptyBatchProducesNoResults() throws IOException {
        assertThat(service.compareAll(List.of(), 0.3)).isEmpty();
    }

    @Test
    void propagatesExtractionFailureOfAnyPair() {
        List<DocumentPair> pairs =
                List.of(
                        pair("a", "Fine.", "Fine."),
                        new DocumentPair(
                                "b",
                                new DocumentInput(
                                        "b.txt",
                                        () -> {
                                            throw new IOException("unreadable");
                                        }),
                                text("b.txt", "Fine.")));

        assertThatThrownBy(() -> service.compareAll(pairs, 0.3))
                .isInstanceOf(DocumentExtractionException.class)
                .hasMessageContaining("b.txt");
    }

    @Test
    void failureCancelsComparisonsStillRunning() throws InterruptedException {
        CountDownLatch slowStarted = new CountDownLatch(1);
        CountDownLatch slowInterrupted = new CountDownLatch(1);
        SentenceSource source =
                new SentenceSource() {
                    @Override
                    public DocumentFormat format() {
                        return DocumentFormat.TEXT;
                    }

                    @Override
                    public List<String> extractSentences(DocumentInput document) throws IOException {
                        try {
                            if (document.filename().startsWith("slow")) {
                                slowStarted.countDown();
                                Thread.sleep(30_000);
                                return List.of("Late.");
                            }
                            slowStarted.await(30, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            slowInterrupted.countDown();
                            Thread.currentThread().interrupt();
                            throw new IOException("interrupted", e);
                        }
                        throw new DocumentExtractionException(document.filename(), "Broken");
                    }
                };
        BatchComparisonService blocking =
                new BatchComparisonService(
                        new ComparisonUseCase(List.of(source), new SentenceAligner()), 2);
        try {
            List<DocumentPair> pairs = List.of(pair("slow", "x", "x"), pair("bad", "x", "x"));

            assertThatThrownBy(() -> blocking.compareAll(pairs, 0.3))
                    .isInstanceOf(DocumentExtractionException.class)
                    .hasMessageContaining("bad.txt");
            assertTrue(slowInterrupted.await(5, TimeUnit.SECONDS));
        } finally {
            blocking.shutdown();
        }
    }

    @Test
    void rejectsInvalidThresholdUpFront() {
        assertThatThrownBy(() -> service.compareAll(List.of(pair("a", "x", "x")), -1))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void usesConfiguredPoolSizeOrFallsBackToProcessorCount() {
        assertEquals(3, service.getThreadPoolSize());

        BatchComparisonService defaults = new BatchComparisonService(useCase, 0);
        try {
            assertEquals(
                    Math.max(1, Runtime.getRuntime().availableProcessors()),
                    defaults.getThreadPoolSize());
        } finally {
            defaults.shutdown();
        }
    }

    private static DocumentPair pair(String key, String left, String right) {
        return new DocumentPair(key, text(key + ".txt", left), text(key + ".txt", right));
    }

    private static DocumentInput text(String filename, String content) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new DocumentInput(filename, () -> new ByteArrayInputStream(bytes));
    }
}
