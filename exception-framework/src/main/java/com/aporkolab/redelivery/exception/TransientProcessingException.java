package com.aporkolab.redelivery.exception;

/**
 * A processing failure expected to go away on its own, e.g. a downstream
 * dependency that is temporarily unavailable. Always retried.
 */
public class TransientProcessingException extends RedeliveryException {

    public TransientProcessingException(String message) {
        super("TRANSIENT_PROCESSING_ERROR", message);
    }

    public TransientProcessingException(String message, Throwable cause) {
        super("TRANSIENT_PROCESSING_ERROR", message, cause);
    }

    public static TransientProcessingException dependencyUnavailable(String dependency, Throwable cause) {
        TransientProcessingException exception = new TransientProcessingException(
                String.format("Dependency '%s' unavailable: %s", dependency, cause.getMessage()), cause);
        exception.with("dependency", dependency);
        return exception;
    }
}
