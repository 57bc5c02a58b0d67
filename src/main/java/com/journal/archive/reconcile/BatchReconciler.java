package com.journal.archive.reconcile;

import com.journal.archive.bulk.ProgressCallback;
import com.journal.archive.descriptor.EntryDescriptor;
import com.journal.archive.logging.LogContext;
import com.journal.archive.metrics.MetricsService;
import com.journal.archive.relation.ReconcileMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reconciles many entries concurrently on a fixed pool. Entries are independent:
 * one failing entry never affects the others.
 */
public class BatchReconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchReconciler.class);

    private final EntryReconciler reconciler;
    private final MetricsService metrics;
    private final ExecutorService executor;

    public BatchReconciler(EntryReconciler reconciler, MetricsService metrics, int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.reconciler = reconciler;
        this.metrics = metrics;
        this.executor = Executors.newFixedThreadPool(parallelism);
    }

    public BatchResult reconcileAll(List<EntryDescriptor> descriptors, ReconcileMode mode) {
        return reconcileAll(descriptors, mode, ProgressCallback.NOOP);
    }

    public BatchResult reconcileAll(List<EntryDescriptor> descriptors, ReconcileMode mode,
                                    ProgressCallback callback) {
        try (LogContext ignored = LogContext.forBatch(LogContext.generateCorrelationId())) {
            long total = descriptors.size();
            metrics.recordBatchSize(descriptors.size());
            AtomicLong processed = new AtomicLong();

            List<CompletableFuture<Object>> futures = descriptors.stream()
                    .map(descriptor -> CompletableFuture.supplyAsync(() -> {
                        try {
                            return (Object) reconciler.reconcile(descriptor, mode);
                        } catch (RuntimeException e) {
                            log.warn("batch.entryFailed entry={} error={}", descriptor.date(), e.getMessage());
                            return new BatchResult.Failure(descriptor.date(), e.getClass().getSimpleName(),
                                    e.getMessage());
                        } finally {
                            callback.onProgress(processed.incrementAndGet(), total, descriptor.date().toString());
                        }
                    }, executor))
                    .toList();

            List<ReconciliationReport> reports = new ArrayList<>();
            List<BatchResult.Failure> failures = new ArrayList<>();
            for (CompletableFuture<Object> future : futures) {
                Object outcome = future.join();
                if (outcome instanceof ReconciliationReport report) {
                    reports.add(report);
                } else {
                    failures.add((BatchResult.Failure) outcome);
                }
            }
            BatchResult result = new BatchResult(reports, failures);
            log.info("batch.completed total={} succeeded={} failed={}", total, reports.size(), failures.size());
            return result;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
