package com.project.image.anomaly.service;

import com.project.image.anomaly.DTOs.AnomalyResult;
import com.project.image.anomaly.exceptions.AnomalyDetectionException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analyses on dedicated worker threads instead of the request thread. A started analysis
 * always runs to completion; one still waiting in the queue is dropped when its caller times out.
 */
@Service
public class AnalysisExecutor {
    private static final Logger log = LoggerFactory.getLogger(AnalysisExecutor.class);

    private final AnomalyDetectionService detectionService;
    private final ExecutorService workers;
    private final long timeoutSeconds;

    @Autowired
    public AnalysisExecutor(AnomalyDetectionService detectionService,
                            @Value("${app.anomaly.worker-threads:2}") int workerThreads,
                            @Value("${app.anomaly.timeout-seconds:60}") long timeoutSeconds) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("app.anomaly.worker-threads must be at least 1");
        }
        this.detectionService = detectionService;
        this.timeoutSeconds = timeoutSeconds;
        this.workers = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
        log.info("Analysis pool started with {} worker thread(s)", workerThreads);
    }

    public CompletableFuture<AnomalyResult> submit(BufferedImage image) {
        return CompletableFuture.supplyAsync(() -> detectionService.analyze(image), workers);
    }

    public AnomalyResult run(BufferedImage image) {
        CompletableFuture<AnomalyResult> future = submit(image);
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new AnomalyDetectionException("Analysis failed: " + cause, cause);
        } catch (TimeoutException e) {
            // drops the task if it is still queued; a started analysis is not interrupted
            future.cancel(false);
            throw new AnomalyDetectionException("Analysis did not finish within " + timeoutSeconds + " seconds", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnomalyDetectionException("Interrupted while waiting for the analysis", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Analysis workers did not finish in time, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "anomaly-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
