package com.aporkolab.redelivery.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all redelivery exceptions.
 *
 * Provides:
 * - Error code for log correlation and alerting rules
 * - Structured context for debugging
 * - Timestamp for correlation
 */
public abstract class RedeliveryException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected RedeliveryException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    protected RedeliveryException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new LinkedHashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining.
     */
    public RedeliveryException with(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
