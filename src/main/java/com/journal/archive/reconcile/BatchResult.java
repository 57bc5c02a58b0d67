package com.journal.archive.reconcile;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of a batch reconciliation. Each entry commits or fails on its own.
 *
 * @param reports  reports of the entries that committed
 * @param failures entries that rolled back, with the reason
 */
public record BatchResult(List<ReconciliationReport> reports, List<Failure> failures) {

    public BatchResult {
        reports = reports != null ? List.copyOf(reports) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public int successCount() {
        return reports.size();
    }

    public int failureCount() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * One entry whose reconciliation rolled back.
     *
     * @param errorType simple class name of the exception
     */
    public record Failure(LocalDate entryDate, String errorType, String message) {
    }

    @Override
    public String toString() {
        return "BatchResult{succeeded=" + reports.size() + ", failed=" + failures.size() + '}';
    }
}
