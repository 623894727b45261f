package com.eventsourcing.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures logs emitted while reading, deciding and appending carry the stream they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forCommand(streamId, "AddProductItemToShoppingCart", 1)) {
 *     log.info("Handling command"); // Automatically includes streamId, commandType, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.e.e.h.CommandHandler - Handling command
 *   streamId=shopping_cart-7f3a commandType=AddProductItemToShoppingCart attempt=1 traceId=1c9e44d0
 */
public final class LoggingContext implements AutoCloseable {

    public static final String STREAM_ID = "streamId";
    public static final String COMMAND_TYPE = "commandType";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Create a logging context for stream reads and appends.
     */
    public static LoggingContext forStream(String streamId) {
        LoggingContext ctx = new LoggingContext();
        if (streamId != null) {
            MDC.put(STREAM_ID, streamId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one attempt at handling a command.
     */
    public static LoggingContext forCommand(String streamId, String commandType, int attempt) {
        LoggingContext ctx = forStream(streamId);
        if (commandType != null) {
            MDC.put(COMMAND_TYPE, commandType);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        return ctx;
    }

    /**
     * Use an externally supplied trace ID, e.g. from an incoming request header.
     */
    public static void setTraceId(String traceId) {
        if (traceId != null && !traceId.isBlank()) {
            MDC.put(TRACE_ID, traceId);
        }
    }

    public static String getStreamId() {
        return MDC.get(STREAM_ID);
    }

    public static String getCommandType() {
        return MDC.get(COMMAND_TYPE);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(STREAM_ID);
        MDC.remove(COMMAND_TYPE);
        MDC.remove(ATTEMPT);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
