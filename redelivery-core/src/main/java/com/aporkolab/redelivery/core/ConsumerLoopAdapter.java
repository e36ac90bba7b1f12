package com.aporkolab.redelivery.core;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.redelivery.exception.ConfigurationException;
import com.aporkolab.redelivery.logging.MessageLoggingContext;

/**
 * Bridges a Kafka {@link Consumer} to the {@link RecoveryCoordinator}.
 *
 * Design decisions:
 * - Records of one partition run sequentially; partitions of one batch run in parallel
 * - Offsets are committed synchronously, per partition, only up to the last terminal record
 * - The first non-terminal record is sought back to, so the broker redelivers it
 * - The retry budget of a whole poll batch must fit inside {@code max.poll.interval.ms}, checked at construction
 * - A commit rejected by a rebalance is logged and polling continues; the new owner replays from the last commit
 *
 * The consumer itself is only touched from the thread calling {@link #run()}, except for
 * {@link Consumer#wakeup()}, which is only issued while that thread is inside {@code poll}.
 * Auto-commit must be disabled on the consumer, and its {@code max.poll.records} must not exceed
 * {@link RedeliveryConfig#maxPollRecords()}.
 */
public class ConsumerLoopAdapter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLoopAdapter.class);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration COMMIT_TIMEOUT = Duration.ofSeconds(30);

    private final Consumer<byte[], byte[]> consumer;
    private final RecoveryCoordinator coordinator;
    private final List<String> topics;
    private final Duration pollTimeout;
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean polling = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    public ConsumerLoopAdapter(Consumer<byte[], byte[]> consumer, RecoveryCoordinator coordinator,
                               RedeliveryConfig config, Collection<String> topics) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (topics == null || topics.isEmpty()) {
            throw new ConfigurationException("topics", "at least one source topic is required");
        }
        this.topics = List.copyOf(topics);
        this.pollTimeout = config.pollTimeout();

        // one partition of a batch may hold every polled record, and each may wait out its full backoff
        Duration perMessage = coordinator.getBackoffPolicy().maxTotalDelay();
        Duration worstCase = perMessage.multipliedBy(config.maxPollRecords());
        if (worstCase.compareTo(config.maxPollInterval()) >= 0) {
            throw new ConfigurationException(RedeliveryConfig.CONSUMER_MAX_POLL_INTERVAL,
                    String.format("retry backoff may wait %d ms per message, %d ms for a batch of %d records, which is not "
                                    + "below max.poll.interval.ms (%d ms); lower backoff.maxRetries, backoff.maxInterval or "
                                    + "consumer.maxPollRecords, or raise the poll interval",
                            perMessage.toMillis(), worstCase.toMillis(), config.maxPollRecords(),
                            config.maxPollInterval().toMillis()));
        }

        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(
                config.concurrency(),
                config.concurrency(),
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "redelivery-worker-" + threadIndex.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
    }

    /**
     * Subscribes and runs the poll loop until {@link #close()} is called. Closes the consumer on exit.
     */
    public void run() {
        if (closed.get() || !running.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer loop already started or closed");
        }
        log.info("Starting redelivery consumer loop for topics {}", topics);
        try {
            consumer.subscribe(topics, new LoggingRebalanceListener());
            while (running.get()) {
                pollOnce();
            }
        } catch (WakeupException e) {
            if (running.get()) {
                throw e;
            }
        } finally {
            running.set(false);
            shutdownWorkers();
            consumer.close();
            stopped.countDown();
            log.info("Redelivery consumer loop stopped");
        }
    }

    /**
     * One poll cycle: fetch, process every partition, commit, seek back where needed.
     */
    void pollOnce() {
        ConsumerRecords<byte[], byte[]> records;
        polling.set(true);
        try {
            // close() only wakes the consumer while this flag is set
            if (closed.get()) {
                return;
            }
            records = consumer.poll(pollTimeout);
        } finally {
            polling.set(false);
        }
        if (records.isEmpty()) {
            return;
        }

        Map<TopicPartition, Future<PartitionProgress>> inFlight = new LinkedHashMap<>();
        for (TopicPartition partition : records.partitions()) {
            List<ConsumerRecord<byte[], byte[]>> batch = records.records(partition);
            inFlight.put(partition, workers.submit(MessageLoggingContext.wrap(() -> processPartition(partition, batch))));
        }

        Map<TopicPartition, OffsetAndMetadata> commits = new LinkedHashMap<>();
        for (Map.Entry<TopicPartition, Future<PartitionProgress>> entry : inFlight.entrySet()) {
            TopicPartition partition = entry.getKey();
            PartitionProgress progress;
            try {
                progress = entry.getValue().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                coordinator.shutdown();
                running.set(false);
                return;
            } catch (ExecutionException e) {
                // nothing is known about this partition; replay the whole batch
                log.error("Worker for {} failed, rewinding to {}", partition, records.records(partition).get(0).offset(), e.getCause());
                consumer.seek(partition, records.records(partition).get(0).offset());
                continue;
            }

            if (progress.nextCommitOffset() >= 0) {
                commits.put(partition, new OffsetAndMetadata(progress.nextCommitOffset()));
            }
            if (progress.resumeOffset() >= 0) {
                consumer.seek(partition, progress.resumeOffset());
            }
        }

        if (!commits.isEmpty()) {
            commit(commits);
        }
    }

    /**
     * Commits terminal offsets. A wakeup from {@link #close()} that raced the end of {@code poll}
     * must not drop the commit of records already dead-lettered, so the commit is retried once.
     */
    private void commit(Map<TopicPartition, OffsetAndMetadata> commits) {
        try {
            commitOrWarn(commits, null);
        } catch (WakeupException e) {
            if (!closed.get()) {
                throw e;
            }
            log.debug("Wakeup raced the commit of {}, retrying", commits);
            commitOrWarn(commits, COMMIT_TIMEOUT);
        }
    }

    private void commitOrWarn(Map<TopicPartition, OffsetAndMetadata> commits, Duration timeout) {
        try {
            if (timeout == null) {
                consumer.commitSync(commits);
            } else {
                consumer.commitSync(commits, timeout);
            }
            log.debug("Committed {}", commits);
        } catch (CommitFailedException | RebalanceInProgressException e) {
            log.warn("Commit of {} rejected, partitions were reassigned; their new owner resumes from the last commit: {}",
                    commits, e.getMessage());
        }
    }

    /**
     * Stops the loop: cancels retry waits, wakes the consumer if it is polling and waits for the loop to exit.
     * Offsets of messages still in flight are not committed; terminal ones of the current batch are.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        boolean wasRunning = running.getAndSet(false);
        coordinator.shutdown();

        if (!wasRunning) {
            shutdownWorkers();
            consumer.close();
            return;
        }

        if (polling.get()) {
            consumer.wakeup();
        }
        try {
            if (!stopped.await(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consumer loop did not stop within {} ms", CLOSE_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private PartitionProgress processPartition(TopicPartition partition, List<ConsumerRecord<byte[], byte[]>> batch) {
        long nextCommit = -1;
        for (ConsumerRecord<byte[], byte[]> record : batch) {
            RecoveryOutcome outcome = coordinator.process(Message.from(record));
            if (!outcome.isTerminal()) {
                log.debug("{} stopped at offset {} ({})", partition, record.offset(), outcome.state());
                return new PartitionProgress(nextCommit, record.offset());
            }
            nextCommit = record.offset() + 1;
        }
        return new PartitionProgress(nextCommit, -1);
    }

    private void shutdownWorkers() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @param nextCommitOffset offset to commit (last terminal + 1), or -1 if none
     * @param resumeOffset     first non-terminal offset to seek back to, or -1 if the batch completed
     */
    record PartitionProgress(long nextCommitOffset, long resumeOffset) {
    }

    private static class LoggingRebalanceListener implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            if (!partitions.isEmpty()) {
                log.info("Partitions revoked: {}", partitions);
            }
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("Partitions assigned: {}", partitions);
        }
    }
}
