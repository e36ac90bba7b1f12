package com.aporkolab.redelivery.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.aporkolab.redelivery.exception.ValidationException;

/**
 * Builds the dead-letter record for a failed message.
 *
 * Design decisions:
 * - Destination topic is the source topic plus a configurable suffix
 * - Payload key and value bytes pass through untouched
 * - Original headers are copied in order, provenance headers are appended after them
 */
public class DeadLetterRouter {

    public static final String DEFAULT_SUFFIX = ".dlt";

    private final String suffix;
    private final PartitionStrategy partitionStrategy;
    private final int fixedPartition;
    private final ErrorClassifier classifier;

    public DeadLetterRouter(String suffix, PartitionStrategy partitionStrategy, int fixedPartition,
                            ErrorClassifier classifier) {
        if (suffix == null || suffix.isBlank()) {
            throw new IllegalArgumentException("suffix must not be null or blank");
        }
        if (fixedPartition < 0) {
            throw new IllegalArgumentException("fixedPartition must be >= 0");
        }
        this.suffix = suffix;
        this.partitionStrategy = Objects.requireNonNull(partitionStrategy, "partitionStrategy must not be null");
        this.fixedPartition = fixedPartition;
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public DeadLetterRouter(ErrorClassifier classifier) {
        this(DEFAULT_SUFFIX, PartitionStrategy.FIXED, 0, classifier);
    }

    public DeadLetterRecord route(Message message, Throwable error, int attemptCount) {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(error, "error must not be null");

        DeadLetterReason reason = reasonFor(error);

        List<MessageHeader> headers = new ArrayList<>(message.headers());
        headers.add(MessageHeader.ofString(DeadLetterHeaders.ORIGINAL_TOPIC, message.sourceTopic()));
        headers.add(MessageHeader.ofString(DeadLetterHeaders.ORIGINAL_PARTITION, String.valueOf(message.sourcePartition())));
        headers.add(MessageHeader.ofString(DeadLetterHeaders.ORIGINAL_OFFSET, String.valueOf(message.offset())));
        headers.add(MessageHeader.ofString(DeadLetterHeaders.EXCEPTION_FQCN, error.getClass().getName()));
        headers.add(MessageHeader.ofString(DeadLetterHeaders.EXCEPTION_MESSAGE,
                error.getMessage() == null ? "" : error.getMessage()));
        headers.add(MessageHeader.ofString(DeadLetterHeaders.ATTEMPT_COUNT, String.valueOf(attemptCount)));
        headers.add(MessageHeader.ofString(DeadLetterHeaders.REASON, reason.name()));

        return new DeadLetterRecord(message, headers, destinationTopic(message.sourceTopic()),
                destinationPartition(message), reason, attemptCount);
    }

    public String destinationTopic(String sourceTopic) {
        return sourceTopic + suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public PartitionStrategy getPartitionStrategy() {
        return partitionStrategy;
    }

    public int getFixedPartition() {
        return fixedPartition;
    }

    private Integer destinationPartition(Message message) {
        return switch (partitionStrategy) {
            case FIXED -> fixedPartition;
            case MIRROR -> message.sourcePartition();
        };
    }

    private DeadLetterReason reasonFor(Throwable error) {
        if (error instanceof ValidationException) {
            return DeadLetterReason.VALIDATION_FAILED;
        }
        return classifier.classify(error) == Classification.TERMINAL
                ? DeadLetterReason.NON_RETRYABLE
                : DeadLetterReason.RETRIES_EXHAUSTED;
    }
}
