package com.example.doccompare.application;

import com.example.doccompare.alignment.SentenceAligner;
import com.example.doccompare.domain.ComparisonRequest;
import com.example.doccompare.domain.ComparisonResult;
import com.example.doccompare.domain.DocumentPair;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Compares many document pairs in parallel. Comparisons share nothing, so each pair runs as an
 * independent task and results are returned in pair order.
 */
@Service
public class BatchComparisonService {
    private static final Logger log = LogManager.getLogger(BatchComparisonService.class);

    private final ComparisonUseCase comparisonUseCase;
    private final int threadPoolSize;
    private final ExecutorService executor;

    public BatchComparisonService(
            ComparisonUseCase comparisonUseCase,
            @Value("${compare.thread-pool-size:0}") int threadPoolSize) {
        this.comparisonUseCase = comparisonUseCase;
        int defaultPoolSize = Runtime.getRuntime().availableProcessors();
        int configuredPoolSize = threadPoolSize > 0 ? threadPoolSize : defaultPoolSize;
        this.threadPoolSize = Math.max(1, configuredPoolSize);
        this.executor = Executors.newFixedThreadPool(this.threadPoolSize);
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public List<PairComparison> compareAll(List<DocumentPair> pairs, double threshold)
            throws IOException {
        SentenceAligner.validateThreshold(threshold);
        if (pairs.isEmpty()) {
            return List.of();
        }
        long start = System.nanoTime();
        CompletionService<Map.Entry<Integer, ComparisonResult>> completionService =
                new ExecutorCompletionService<>(executor);
        List<Future<Map.Entry<Integer, ComparisonResult>>> submitted = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            int index = i;
            DocumentPair pair = pairs.get(i);
            submitted.add(
                    completionService.submit(
                            () ->
                                    Map.entry(
                                            index,
                                            comparisonUseCase.compare(
                                                    new ComparisonRequest(
                                                            pair.left(), pair.right(), threshold)))));
        }

        ComparisonResult[] results = new ComparisonResult[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            try {
                Future<Map.Entry<Integer, ComparisonResult>> future = completionService.take();
                Map.Entry<Integer, ComparisonResult> entry = future.get();
                results[entry.getKey()] = entry.getValue();
            } catch (InterruptedException e) {
                cancelAll(submitted);
                Thread.currentThread().interrupt();
                throw new IOException("Comparison interrupted", e);
            } catch (ExecutionException e) {
                cancelAll(submitted);
                Throwable cause = e.getCause();
                if (cause instanceof IOException) {
                    throw (IOException) cause;
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IOException("Failed to compare documents", cause);
            }
        }

        List<PairComparison> comparisons = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            comparisons.add(new PairComparison(pairs.get(i).key(), results[i]));
        }
        log.info(
                "Compared {} document pairs in {}s",
                pairs.size(),
                (System.nanoTime() - start) / 1_000_000_000.0);
        return comparisons;
    }

    // completed futures ignore the cancel
    private static void cancelAll(List<? extends Future<?>> futures) {
        int cancelled = 0;
        for (Future<?> future : futures) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending comparisons", cancelled);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public record PairComparison(String key, ComparisonResult result) {}
}
