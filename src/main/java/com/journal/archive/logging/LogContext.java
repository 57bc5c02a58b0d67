package com.journal.archive.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forReconcile(LogContext.generateCorrelationId(), date, "REPLACE")) {
 *     log.info("reconcile.completed entry={} changes={}", date, changes);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forReconcile(String correlationId, Object entryDate, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entryDate", String.valueOf(entryDate));
        ctx.put("mode", mode);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static LogContext forSweep(String sweepId) {
        LogContext ctx = new LogContext();
        ctx.put("sweepId", sweepId);
        ctx.put("operation", "sweep");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, String entityKind, long entityId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("entityKind", entityKind);
        ctx.put("entityId", Long.toString(entityId));
        ctx.put("operation", "merge-back");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
