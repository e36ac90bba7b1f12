package com.aporkolab.redelivery.core;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.redelivery.exception.DeliveryException;
import com.aporkolab.redelivery.logging.MessageLoggingContext;

/**
 * Drives one message to a terminal disposition: success, or a confirmed dead-letter write.
 *
 * Design decisions:
 * - Validation runs once before the handler; its failure takes the same path as a handler failure
 * - Terminal errors skip the retry budget and go straight to the dead-letter topic
 * - Retry waits block the calling partition worker, so per-partition order is kept
 * - A dead-letter write is retried until the broker acknowledges it; the message is never dropped
 * - Shutdown cancels every wait; the message is then ABANDONED and left uncommitted
 *
 * Thread-safe: one instance is shared by all partition workers.
 */
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final MessageHandler handler;
    private final MessageValidator validator;
    private final RetryTracker retryTracker;
    private final BackoffPolicy backoffPolicy;
    private final DeadLetterRouter router;
    private final DeadLetterPublisher publisher;
    private final BackoffPolicy deliveryBackoff;
    private final Duration publishTimeout;
    private final List<RecoveryListener> listeners;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private RecoveryCoordinator(Builder builder) {
        RedeliveryConfig config = builder.config;
        ErrorClassifier classifier = builder.classifier != null ? builder.classifier : config.errorClassifier();

        this.handler = builder.handler;
        this.validator = builder.validator;
        this.backoffPolicy = config.backoffPolicy();
        this.retryTracker = new RetryTracker(backoffPolicy, classifier, builder.clock);
        this.router = config.deadLetterRouter(classifier);
        this.publisher = builder.publisher;
        this.deliveryBackoff = config.deliveryBackoffPolicy();
        this.publishTimeout = config.publishTimeout();
        this.listeners = List.copyOf(builder.listeners);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Processes a message until it reaches SUCCEEDED or DEAD_LETTERED, or shutdown abandons it.
     * Handler and validator failures never escape this method.
     */
    public RecoveryOutcome process(Message message) {
        Objects.requireNonNull(message, "message must not be null");
        MessageHeader correlation = message.lastHeader(MessageLoggingContext.CORRELATION_ID_HEADER);

        try (MessageLoggingContext ctx = MessageLoggingContext.open(message.sourceTopic(), message.sourcePartition(),
                message.offset(), correlation == null ? null : correlation.valueAsString())) {

            RecoveryState state = RecoveryState.RECEIVED;
            notify(l -> l.onReceived(message));
            boolean validated = false;
            int attempts = 0;

            while (true) {
                if (isShuttingDown()) {
                    return abandon(message, attempts);
                }
                state = transition(message, state, RecoveryState.PROCESSING);
                ctx.attempt(attempts + 1);

                Exception failure;
                try {
                    if (!validated) {
                        validator.validate(message);
                        validated = true;
                    }
                    attempts++;
                    handler.handle(message);

                    transition(message, state, RecoveryState.SUCCEEDED);
                    retryTracker.clear(message.messageId());
                    log.debug("Processed {} after {} attempt(s)", message.messageId(), attempts);
                    int made = attempts;
                    notify(l -> l.onSuccess(message, made));
                    return RecoveryOutcome.succeeded(message, attempts);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return abandon(message, attempts);
                } catch (Exception e) {
                    failure = e;
                }

                state = transition(message, state, RecoveryState.FAILED);
                RetryState retryState = retryTracker.recordFailure(message, failure);
                // a failed validation counts as an attempt even though the handler never ran
                attempts = retryState.attemptCount();

                if (retryTracker.shouldRetry(retryState)) {
                    Duration delay = retryTracker.nextDelay(retryState).delay();
                    state = transition(message, state, RecoveryState.AWAITING_RETRY);
                    log.info("Attempt {}/{} of {} failed ({}: {}), retrying in {} ms",
                            retryState.attemptCount(), backoffPolicy.getSchedule().maxRetries(), message.messageId(),
                            failure.getClass().getSimpleName(), failure.getMessage(), delay.toMillis());
                    notify(l -> l.onRetryScheduled(message, retryState, delay));

                    if (!await(delay)) {
                        return abandon(message, retryState.attemptCount());
                    }
                    continue;
                }

                state = transition(message, state, RecoveryState.DEAD_LETTERING);
                DeadLetterRecord record = router.route(message, failure, retryState.attemptCount());
                log.warn("Dead-lettering {} to {} after {} attempt(s), reason={}: {}",
                        message.messageId(), record.destinationTopic(), record.attemptCount(), record.reason(),
                        failure.toString());

                if (!deliver(record)) {
                    return abandon(message, retryState.attemptCount());
                }

                transition(message, state, RecoveryState.DEAD_LETTERED);
                retryTracker.clear(message.messageId());
                notify(l -> l.onDeadLettered(record));
                return RecoveryOutcome.deadLettered(record);
            }
        }
    }

    /**
     * Cancels every pending retry and delivery wait. In-flight messages are abandoned, not committed.
     */
    public void shutdown() {
        if (shutdownLatch.getCount() > 0) {
            log.info("Recovery coordinator shutting down, cancelling pending retries");
            shutdownLatch.countDown();
        }
    }

    public boolean isShuttingDown() {
        return shutdownLatch.getCount() == 0;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    public RetryTracker getRetryTracker() {
        return retryTracker;
    }

    public DeadLetterRouter getRouter() {
        return router;
    }

    /**
     * Publishes the record until acknowledged. Returns false if shutdown interrupted the loop.
     */
    private boolean deliver(DeadLetterRecord record) {
        int deliveryAttempt = 0;
        while (true) {
            deliveryAttempt++;
            DeliveryException failure;
            CompletableFuture<RecordMetadata> future = null;
            try {
                future = publisher.publish(record);
                future.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                failure = KafkaDeadLetterPublisher.toDeliveryException(record.destinationTopic(),
                        e.getCause() != null ? e.getCause() : e);
            } catch (TimeoutException e) {
                future.cancel(false);
                failure = new DeliveryException(record.destinationTopic(),
                        new TimeoutException("no acknowledgment within " + publishTimeout.toMillis() + " ms"));
                failure.with(DeliveryException.POSSIBLE_DUPLICATE, true);
                Message original = record.original();
                log.warn("Dead-letter write of {} to {} timed out and may still be acknowledged; the retry can leave "
                                + "a duplicate with original-topic={} original-partition={} original-offset={}",
                        original.messageId(), record.destinationTopic(), original.sourceTopic(),
                        original.sourcePartition(), original.offset());
            } catch (RuntimeException e) {
                failure = KafkaDeadLetterPublisher.toDeliveryException(record.destinationTopic(), e);
            }

            Duration delay = deliveryBackoff.nextDelay(deliveryAttempt).delay();
            if (failure.isDestinationMissing()) {
                log.error("Dead-letter topic {} does not exist; create it to unblock {} (attempt {}, retrying in {} ms)",
                        record.destinationTopic(), record.original().messageId(), deliveryAttempt, delay.toMillis());
            } else {
                log.warn("Dead-letter write of {} failed (attempt {}), retrying in {} ms: {}",
                        record.original().messageId(), deliveryAttempt, delay.toMillis(), failure.getMessage());
            }
            int attempt = deliveryAttempt;
            DeliveryException error = failure;
            notify(l -> l.onDeliveryFailure(record, error, attempt));

            if (!await(delay)) {
                return false;
            }
        }
    }

    /**
     * Waits for the delay. Returns false if shutdown started or the thread was interrupted.
     */
    private boolean await(Duration delay) {
        try {
            return !shutdownLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private RecoveryOutcome abandon(Message message, int attempts) {
        log.info("Abandoning {} after {} attempt(s); it will be redelivered after restart",
                message.messageId(), attempts);
        retryTracker.clear(message.messageId());
        notify(l -> l.onAbandoned(message, attempts));
        return RecoveryOutcome.abandoned(message, attempts);
    }

    private RecoveryState transition(Message message, RecoveryState from, RecoveryState to) {
        log.trace("{}: {} -> {}", message.messageId(), from, to);
        return to;
    }

    private void notify(Consumer<RecoveryListener> callback) {
        for (RecoveryListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Recovery listener {} failed: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    public static class Builder {
        private RedeliveryConfig config = RedeliveryConfig.defaults();
        private ErrorClassifier classifier;
        private MessageHandler handler;
        private MessageValidator validator = MessageValidator.NONE;
        private DeadLetterPublisher publisher;
        private Clock clock = Clock.systemUTC();
        private final List<RecoveryListener> listeners = new ArrayList<>();

        public Builder config(RedeliveryConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Overrides the classifier built from {@code nonRetryableErrorKinds}.
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder handler(MessageHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder validator(MessageValidator validator) {
            this.validator = validator == null ? MessageValidator.NONE : validator;
            return this;
        }

        public Builder publisher(DeadLetterPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder listener(RecoveryListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public RecoveryCoordinator build() {
            if (handler == null) {
                throw new IllegalArgumentException("handler is required");
            }
            if (publisher == null) {
                throw new IllegalArgumentException("publisher is required");
            }
            return new RecoveryCoordinator(this);
        }
    }
}
