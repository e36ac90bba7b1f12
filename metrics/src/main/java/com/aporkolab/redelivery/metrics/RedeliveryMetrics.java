package com.aporkolab.redelivery.metrics;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import com.aporkolab.redelivery.core.DeadLetterRecord;
import com.aporkolab.redelivery.core.Message;
import com.aporkolab.redelivery.core.RecoveryListener;
import com.aporkolab.redelivery.core.RetryState;
import com.aporkolab.redelivery.exception.DeliveryException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer metrics for the redelivery coordinator. Register as a {@link RecoveryListener}.
 *
 * Provides the following metrics:
 * - redelivery_messages_total{outcome}: Messages by final disposition (succeeded, dead_lettered, abandoned)
 * - redelivery_retries_total: Retries scheduled
 * - redelivery_dead_letter_total{original_topic, reason}: Records written to dead-letter topics
 * - redelivery_delivery_failures_total{destination_missing}: Failed dead-letter writes
 * - redelivery_in_flight: Messages currently inside the coordinator
 * - redelivery_retry_delay: Backoff delays handed out
 */
public class RedeliveryMetrics implements RecoveryListener {

    private static final String METRIC_PREFIX = "redelivery";

    private final MeterRegistry registry;
    private final Tags baseTags;

    private final Counter succeededCounter;
    private final Counter deadLetteredCounter;
    private final Counter abandonedCounter;
    private final Counter retriesCounter;
    private final Timer retryDelayTimer;
    private final AtomicInteger inFlight = new AtomicInteger(0);

    public RedeliveryMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public RedeliveryMetrics(MeterRegistry registry, String consumerName) {
        this(registry, Tags.of("consumer", consumerName));
    }

    public RedeliveryMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        this.succeededCounter = outcomeCounter("succeeded");
        this.deadLetteredCounter = outcomeCounter("dead_lettered");
        this.abandonedCounter = outcomeCounter("abandoned");

        this.retriesCounter = Counter.builder(METRIC_PREFIX + "_retries_total")
                .description("Retries scheduled after a retryable failure")
                .tags(baseTags)
                .register(registry);

        this.retryDelayTimer = Timer.builder(METRIC_PREFIX + "_retry_delay")
                .description("Backoff delay before each retry")
                .tags(baseTags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder(METRIC_PREFIX + "_in_flight", inFlight, AtomicInteger::get)
                .description("Messages currently being processed, retried or dead-lettered")
                .tags(baseTags)
                .register(registry);
    }

    @Override
    public void onReceived(Message message) {
        inFlight.incrementAndGet();
    }

    @Override
    public void onSuccess(Message message, int attempts) {
        succeededCounter.increment();
        inFlight.decrementAndGet();
    }

    @Override
    public void onRetryScheduled(Message message, RetryState state, Duration delay) {
        retriesCounter.increment();
        retryDelayTimer.record(delay);
    }

    @Override
    public void onDeadLettered(DeadLetterRecord record) {
        deadLetteredCounter.increment();
        inFlight.decrementAndGet();

        Counter.builder(METRIC_PREFIX + "_dead_letter_total")
                .tags(baseTags.and("original_topic", record.original().sourceTopic(), "reason", record.reason().name()))
                .description("Records written to a dead-letter topic")
                .register(registry)
                .increment();
    }

    @Override
    public void onDeliveryFailure(DeadLetterRecord record, DeliveryException error, int deliveryAttempt) {
        Counter.builder(METRIC_PREFIX + "_delivery_failures_total")
                .tags(baseTags.and("destination_missing", String.valueOf(error.isDestinationMissing())))
                .description("Failed dead-letter writes, retried until acknowledged")
                .register(registry)
                .increment();
    }

    @Override
    public void onAbandoned(Message message, int attempts) {
        abandonedCounter.increment();
        inFlight.decrementAndGet();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Share of finished messages that needed the dead-letter topic, in percent.
     */
    public double getDeadLetterRate() {
        double total = succeededCounter.count() + deadLetteredCounter.count();
        if (total == 0) return 0.0;
        return (deadLetteredCounter.count() / total) * 100.0;
    }

    private Counter outcomeCounter(String outcome) {
        return Counter.builder(METRIC_PREFIX + "_messages_total")
                .description("Messages by final disposition")
                .tags(baseTags.and("outcome", outcome))
                .register(registry);
    }
}
