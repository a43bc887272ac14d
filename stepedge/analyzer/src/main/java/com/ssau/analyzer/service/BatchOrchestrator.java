package com.ssau.analyzer.service;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.ImageSource;

/**
 * Analyzes images in consecutive groups of {@code concurrencyLimit}. A group
 * runs concurrently and must finish before the next one starts. Failed or
 * skipped images contribute nothing.
 */
@Slf4j
public class BatchOrchestrator implements Closeable {

    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int completed, int total);
    }

    private final ImageAnalyzer analyzer;
    private final int concurrencyLimit;
    private final ExecutorService executor;

    public BatchOrchestrator(ImageAnalyzer analyzer, int concurrencyLimit) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, got " + concurrencyLimit);
        }
        this.analyzer = analyzer;
        this.concurrencyLimit = concurrencyLimit;
        this.executor = Executors.newFixedThreadPool(concurrencyLimit, new AnalyzerThreadFactory());
    }

    public List<ImageAnalysis> process(List<ImageSource> sources, ProgressListener listener)
            throws InterruptedException {
        int total = sources.size();
        List<ImageAnalysis> results = new ArrayList<>(total);

        for (int groupStart = 0; groupStart < total; groupStart += concurrencyLimit) {
            int groupEnd = Math.min(groupStart + concurrencyLimit, total);
            List<Future<Optional<ImageAnalysis>>> group = new ArrayList<>(groupEnd - groupStart);
            for (int i = groupStart; i < groupEnd; i++) {
                ImageSource source = sources.get(i);
                group.add(executor.submit(() -> analyzeQuietly(source)));
            }

            for (Future<Optional<ImageAnalysis>> future : group) {
                try {
                    future.get().ifPresent(results::add);
                } catch (ExecutionException e) {
                    log.warn("Image task failed", e.getCause());
                } catch (InterruptedException e) {
                    group.forEach(f -> f.cancel(true));
                    throw e;
                }
            }

            log.info("Progress: {}/{} images", groupEnd, total);
            if (listener != null) {
                listener.onProgress(groupEnd, total);
            }
        }
        return results;
    }

    private Optional<ImageAnalysis> analyzeQuietly(ImageSource source) {
        try {
            return analyzer.analyze(source);
        } catch (Exception e) {
            log.warn("Skipping image {}: {}", source.getName(), e.getMessage());
            log.debug("Failure details for {}", source.getName(), e);
            return Optional.empty();
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Image analysis workers did not stop in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class AnalyzerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "image-analyzer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
