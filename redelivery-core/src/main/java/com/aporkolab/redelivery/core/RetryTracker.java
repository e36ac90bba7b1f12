package com.aporkolab.redelivery.core;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks retry attempts per message (key = topic-partition@offset).
 *
 * State lives in memory only: after a restart the broker redelivers the
 * uncommitted message and counting starts from zero again. This class never
 * schedules timers; it only advises how long the caller should wait.
 */
public class RetryTracker {

    private final BackoffPolicy backoffPolicy;
    private final ErrorClassifier classifier;
    private final Clock clock;
    private final Map<String, RetryState> states = new ConcurrentHashMap<>();

    public RetryTracker(BackoffPolicy backoffPolicy, ErrorClassifier classifier) {
        this(backoffPolicy, classifier, Clock.systemUTC());
    }

    public RetryTracker(BackoffPolicy backoffPolicy, ErrorClassifier classifier, Clock clock) {
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records a failed attempt, creating the state on the first failure.
     */
    public RetryState recordFailure(Message message, Throwable error) {
        Classification classification = classifier.classify(error);
        return states.compute(message.messageId(), (id, current) -> current == null
                ? new RetryState(id, 1, clock.instant(), error, classification)
                : current.next(error, classification));
    }

    /**
     * True while the budget is not exhausted and the last failure was retryable.
     */
    public boolean shouldRetry(RetryState state) {
        return state.lastClassification() == Classification.RETRYABLE
                && !backoffPolicy.nextDelay(state.attemptCount()).exhausted();
    }

    public BackoffDecision nextDelay(RetryState state) {
        return backoffPolicy.nextDelay(state.attemptCount());
    }

    public Optional<RetryState> find(String messageId) {
        return Optional.ofNullable(states.get(messageId));
    }

    /**
     * Forget a message once it reached a terminal disposition.
     */
    public void clear(String messageId) {
        states.remove(messageId);
    }

    public int inFlight() {
        return states.size();
    }
}
