package com.aporkolab.redelivery.logging;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Puts the provenance of the message currently being processed into the MDC
 * (Mapped Diagnostic Context), so every log line written by the handler, the
 * retry loop and the dead-letter publisher can be traced back to one record.
 *
 * Usage:
 * <pre>
 * try (var ctx = MessageLoggingContext.open("orders", 3, 1042L, correlationIdHeader)) {
 *     log.info("Processing"); // Logs include messageTopic, messagePartition, messageOffset, correlationId
 * }
 * </pre>
 */
public class MessageLoggingContext implements AutoCloseable {

    public static final String TOPIC_KEY = "messageTopic";
    public static final String PARTITION_KEY = "messagePartition";
    public static final String OFFSET_KEY = "messageOffset";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String ATTEMPT_KEY = "attempt";

    // Kafka header carrying the correlation id across services
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final Map<String, String> previousContext;

    private MessageLoggingContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Opens a context for one message. A blank correlation id is replaced by a generated one.
     */
    public static MessageLoggingContext open(String topic, int partition, long offset, String correlationId) {
        Map<String, String> previous = MDC.getCopyOfContextMap();

        MDC.put(TOPIC_KEY, topic);
        MDC.put(PARTITION_KEY, String.valueOf(partition));
        MDC.put(OFFSET_KEY, String.valueOf(offset));
        MDC.put(CORRELATION_ID_KEY,
                correlationId == null || correlationId.isBlank() ? generateId() : correlationId);

        return new MessageLoggingContext(previous);
    }

    /**
     * Gets the current correlation ID, or null if no message is in flight on this thread.
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    /**
     * Records the handler attempt currently running.
     */
    public MessageLoggingContext attempt(int attempt) {
        MDC.put(ATTEMPT_KEY, String.valueOf(attempt));
        return this;
    }

    /**
     * Wraps a Callable so it runs with the MDC of the submitting thread.
     * Worker pools use this to keep the caller's context on partition workers.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                return callable.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    @Override
    public void close() {
        if (previousContext != null) {
            MDC.setContextMap(previousContext);
        } else {
            MDC.clear();
        }
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
