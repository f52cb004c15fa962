package com.file.dedup.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close,
 * so contexts may be nested.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMoveBatch(batchId, groupId)) {
 *     log.info("move.completed source={} destination={}", source, destination);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // key -> value it had before this context, or null if it was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a discovery and analysis run.
     */
    public static LogContext forScan(String scanId) {
        LogContext ctx = new LogContext();
        ctx.put("scanId", scanId);
        ctx.put("operation", "scan");
        return ctx;
    }

    /**
     * Creates a log context for work on one duplicate group.
     */
    public static LogContext forGroup(int groupId) {
        LogContext ctx = new LogContext();
        ctx.put("groupId", String.valueOf(groupId));
        ctx.put("operation", "consolidate");
        return ctx;
    }

    /**
     * Creates a log context for one transactional batch of moves.
     */
    public static LogContext forMoveBatch(String batchId, int groupId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("groupId", String.valueOf(groupId));
        ctx.put("operation", "move");
        return ctx;
    }

    /**
     * Generates a unique identifier for a scan or batch.
     */
    public static String generateId() {
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
