package com.age.mcp.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable wrapper around the SLF4J MDC. Keys added through this context are
 * removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forTransaction(context.getId(), "main", "SERIALIZABLE")) {
 *     log.info("transaction.committed durationMs={}", elapsed);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CONTEXT_ID = "executionContext";
    public static final String CONNECTION = "connection";
    public static final String OPERATION = "operation";
    public static final String ISOLATION = "isolation";
    public static final String REASON = "reason";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for engine lifecycle operations of one execution context.
     */
    public static LogContext forContext(String contextId, String connectionName) {
        LogContext ctx = new LogContext();
        ctx.put(CONTEXT_ID, contextId);
        ctx.put(CONNECTION, connectionName);
        ctx.put(OPERATION, "lifecycle");
        return ctx;
    }

    /**
     * Context for a scoped transaction. A null isolation level is logged as {@code default}.
     */
    public static LogContext forTransaction(String contextId, String connectionName, String isolation) {
        LogContext ctx = new LogContext();
        ctx.put(CONTEXT_ID, contextId);
        ctx.put(CONNECTION, connectionName);
        ctx.put(OPERATION, "transaction");
        ctx.put(ISOLATION, isolation != null ? isolation : "default");
        return ctx;
    }

    /**
     * Adds one more key to this context; it is removed on close like the others.
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
