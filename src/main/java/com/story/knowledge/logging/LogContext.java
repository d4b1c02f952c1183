package com.story.knowledge.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forTransaction(txId, entityId, "commit")) {
 *     log.info("transaction.committed");
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one coordinator operation on a transaction.
     */
    public static LogContext forTransaction(String transactionId, String entityId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("transactionId", transactionId);
        ctx.put("entityId", entityId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a reconciliation sweep.
     */
    public static LogContext forReconciliation(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("reconciliationRun", runId);
        ctx.put("operation", "reconcile");
        return ctx;
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
