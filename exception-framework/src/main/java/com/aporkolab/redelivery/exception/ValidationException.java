package com.aporkolab.redelivery.exception;

import java.util.List;

/**
 * Validation errors - the message content itself is invalid.
 * Never retried: redelivering the same bytes cannot change the outcome.
 */
public class ValidationException extends RedeliveryException {

    private final List<FieldError> errors;

    public ValidationException(String field, String message) {
        super("VALIDATION_ERROR", String.format("Validation failed for '%s': %s", field, message));
        this.errors = List.of(new FieldError(field, message));
        with("field", field);
    }

    public ValidationException(List<FieldError> errors) {
        super("VALIDATION_ERROR", "Validation failed for multiple fields: " + errors);
        this.errors = List.copyOf(errors);
        with("errors", this.errors);
    }

    public ValidationException(String message, Throwable cause) {
        super("VALIDATION_ERROR", message, cause);
        this.errors = List.of();
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    public record FieldError(String field, String message) {}
}
