package com.aporkolab.redelivery.core;

import java.util.List;

/**
 * Provenance headers added to every dead-letter record. All values are UTF-8 strings.
 */
public final class DeadLetterHeaders {

    private DeadLetterHeaders() {}

    public static final String ORIGINAL_TOPIC = "original-topic";
    public static final String ORIGINAL_PARTITION = "original-partition";
    public static final String ORIGINAL_OFFSET = "original-offset";
    public static final String EXCEPTION_FQCN = "exception-fqcn";
    public static final String EXCEPTION_MESSAGE = "exception-message";
    public static final String ATTEMPT_COUNT = "attempt-count";
    public static final String REASON = "dead-letter-reason";

    public static final List<String> PROVENANCE = List.of(
            ORIGINAL_TOPIC,
            ORIGINAL_PARTITION,
            ORIGINAL_OFFSET,
            EXCEPTION_FQCN,
            EXCEPTION_MESSAGE,
            ATTEMPT_COUNT,
            REASON
    );
}
