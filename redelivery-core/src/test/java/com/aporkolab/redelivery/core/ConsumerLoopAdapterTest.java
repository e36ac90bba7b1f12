package com.aporkolab.redelivery.core;

import static com.aporkolab.redelivery.core.TestMessages.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.aporkolab.redelivery.exception.ConfigurationException;
import com.aporkolab.redelivery.exception.TransientProcessingException;
import com.aporkolab.redelivery.exception.ValidationException;

class ConsumerLoopAdapterTest {

    private static final TopicPartition P0 = new TopicPartition("orders", 0);
    private static final TopicPartition P1 = new TopicPartition("orders", 1);

    private CommitTrackingConsumer consumer;
    private RecordingPublisher publisher;
    private ConsumerLoopAdapter adapter;

    @BeforeEach
    void setUp() {
        consumer = new CommitTrackingConsumer();
        publisher = new RecordingPublisher();
    }

    @AfterEach
    void tearDown() {
        if (adapter != null) {
            adapter.close();
        }
    }

    private static RedeliveryConfig config() {
        return RedeliveryConfig.builder()
                .backoff(BackoffSchedule.builder()
                        .initialInterval(Duration.ofMillis(5))
                        .maxInterval(Duration.ofMillis(20))
                        .maxRetries(2)
                        .build())
                .pollTimeout(Duration.ofMillis(50))
                .concurrency(2)
                .build();
    }

    private ConsumerLoopAdapter adapter(MessageHandler handler) {
        RecoveryCoordinator coordinator = RecoveryCoordinator.builder()
                .config(config())
                .handler(handler)
                .publisher(publisher)
                .build();
        adapter = new ConsumerLoopAdapter(consumer, coordinator, config(), List.of("orders"));
        return adapter;
    }

    private void assign(TopicPartition... partitions) {
        consumer.assign(List.of(partitions));
        Map<TopicPartition, Long> beginning = new HashMap<>();
        for (TopicPartition partition : partitions) {
            beginning.put(partition, 0L);
        }
        consumer.updateBeginningOffsets(beginning);
    }

    private void addRecord(TopicPartition partition, long offset, String value) {
        consumer.addRecord(new ConsumerRecord<>(partition.topic(), partition.partition(), offset,
                utf8("key-" + offset), utf8(value)));
    }

    private long committed(TopicPartition partition) {
        OffsetAndMetadata offset = consumer.committed(Set.of(partition)).get(partition);
        return offset == null ? -1 : offset.offset();
    }

    @Nested
    @DisplayName("Poll cycle")
    class PollCycle {

        @Test
        @DisplayName("commits after the last record once every record succeeded")
        void commitsAfterSuccess() {
            List<String> handled = new CopyOnWriteArrayList<>();
            ConsumerLoopAdapter loop = adapter(m -> handled.add(new String(m.value(), StandardCharsets.UTF_8)));
            assign(P0);
            addRecord(P0, 0, "a");
            addRecord(P0, 1, "b");
            addRecord(P0, 2, "c");

            loop.pollOnce();

            assertThat(handled).containsExactly("a", "b", "c");
            assertThat(committed(P0)).isEqualTo(3);
            assertThat(publisher.attempts).isEmpty();
        }

        @Test
        @DisplayName("dead-lettered records are committed too")
        void commitsAfterDeadLetter() {
            ConsumerLoopAdapter loop = adapter(m -> {
                if (m.offset() == 1) {
                    throw new TransientProcessingException("always failing");
                }
            });
            assign(P0);
            addRecord(P0, 0, "a");
            addRecord(P0, 1, "b");
            addRecord(P0, 2, "c");

            loop.pollOnce();

            assertThat(committed(P0)).isEqualTo(3);
            assertThat(publisher.acknowledged).hasSize(1);
            assertThat(publisher.acknowledged.get(0).original().offset()).isEqualTo(1);
        }

        @Test
        @DisplayName("keeps order within a partition and processes partitions on worker threads")
        void partitionsOnWorkers() {
            Map<Integer, List<Long>> offsetsByPartition = new ConcurrentHashMap<>();
            List<String> threads = new CopyOnWriteArrayList<>();
            ConsumerLoopAdapter loop = adapter(m -> {
                offsetsByPartition.computeIfAbsent(m.sourcePartition(), p -> new CopyOnWriteArrayList<>()).add(m.offset());
                threads.add(Thread.currentThread().getName());
            });
            assign(P0, P1);
            for (long offset = 0; offset < 5; offset++) {
                addRecord(P0, offset, "p0-" + offset);
                addRecord(P1, offset, "p1-" + offset);
            }

            loop.pollOnce();

            assertThat(offsetsByPartition.get(0)).containsExactly(0L, 1L, 2L, 3L, 4L);
            assertThat(offsetsByPartition.get(1)).containsExactly(0L, 1L, 2L, 3L, 4L);
            assertThat(threads).allMatch(name -> name.startsWith("redelivery-worker-"));
            assertThat(committed(P0)).isEqualTo(5);
            assertThat(committed(P1)).isEqualTo(5);
        }

        @Test
        @DisplayName("abandoned record is not committed and is sought back to")
        void seeksBackToAbandoned() {
            AtomicReference<RecoveryCoordinator> coordinator = new AtomicReference<>();
            coordinator.set(RecoveryCoordinator.builder()
                    .config(config())
                    .handler(m -> {
                        if (m.offset() == 1) {
                            // shutdown arrives while this record is failing
                            coordinator.get().shutdown();
                            throw new TransientProcessingException("interrupted by shutdown");
                        }
                    })
                    .publisher(publisher)
                    .build());
            adapter = new ConsumerLoopAdapter(consumer, coordinator.get(), config(), List.of("orders"));
            assign(P0);
            addRecord(P0, 0, "a");
            addRecord(P0, 1, "b");
            addRecord(P0, 2, "c");

            adapter.pollOnce();

            assertThat(committed(P0)).isEqualTo(1);
            assertThat(consumer.position(P0)).isEqualTo(1);
            assertThat(publisher.attempts).isEmpty();
        }

        @Test
        @DisplayName("empty poll commits nothing")
        void emptyPoll() {
            ConsumerLoopAdapter loop = adapter(m -> { });
            assign(P0);

            loop.pollOnce();

            assertThat(committed(P0)).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("Startup checks")
    class StartupChecks {

        @Test
        @DisplayName("rejects a retry budget longer than the poll interval")
        void rejectsLongRetryBudget() {
            RedeliveryConfig slow = RedeliveryConfig.builder()
                    .backoff(BackoffSchedule.builder()
                            .initialInterval(Duration.ofSeconds(10))
                            .maxInterval(Duration.ofMinutes(1))
                            .maxRetries(10)
                            .build())
                    .maxPollInterval(Duration.ofMinutes(5))
                    .build();
            RecoveryCoordinator coordinator = RecoveryCoordinator.builder()
                    .config(slow)
                    .handler(m -> { })
                    .publisher(publisher)
                    .build();

            assertThatThrownBy(() -> new ConsumerLoopAdapter(consumer, coordinator, slow, List.of("orders")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("consumer.maxPollInterval");
        }

        @Test
        @DisplayName("budgets retries for a whole poll batch, not one message")
        void budgetsWholeBatch() {
            // 3 s per message: 1 s + 2 s
            RedeliveryConfig.Builder builder = RedeliveryConfig.builder()
                    .backoff(BackoffSchedule.builder()
                            .initialInterval(Duration.ofSeconds(1))
                            .maxInterval(Duration.ofSeconds(10))
                            .maxRetries(3)
                            .build())
                    .maxPollInterval(Duration.ofMinutes(1));
            RedeliveryConfig fiftyRecords = builder.maxPollRecords(50).build();
            RedeliveryConfig tenRecords = builder.maxPollRecords(10).build();
            RecoveryCoordinator coordinator = RecoveryCoordinator.builder()
                    .config(fiftyRecords)
                    .handler(m -> { })
                    .publisher(publisher)
                    .build();

            assertThatThrownBy(() -> new ConsumerLoopAdapter(consumer, coordinator, fiftyRecords, List.of("orders")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("150000 ms for a batch of 50 records");

            adapter = new ConsumerLoopAdapter(consumer, coordinator, tenRecords, List.of("orders"));
            assertThat(adapter.isRunning()).isFalse();
        }

        @Test
        @DisplayName("requires at least one topic")
        void requiresTopics() {
            RecoveryCoordinator coordinator = RecoveryCoordinator.builder()
                    .handler(m -> { })
                    .publisher(publisher)
                    .build();

            assertThatThrownBy(() -> new ConsumerLoopAdapter(consumer, coordinator, config(), List.of()))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("runs until closed, then closes the consumer")
        void runUntilClosed() throws Exception {
            List<Long> handled = new CopyOnWriteArrayList<>();
            ConsumerLoopAdapter loop = adapter(m -> handled.add(m.offset()));
            consumer.schedulePollTask(() -> {
                consumer.updateBeginningOffsets(Map.of(P0, 0L));
                consumer.rebalance(List.of(P0));
                addRecord(P0, 0, "a");
                addRecord(P0, 1, "b");
            });

            Thread runner = new Thread(loop::run, "consumer-loop");
            runner.start();

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                assertThat(handled).containsExactly(0L, 1L);
                assertThat(committed(P0)).isEqualTo(2);
            });

            loop.close();
            runner.join(5000);

            assertThat(runner.isAlive()).isFalse();
            assertThat(loop.isRunning()).isFalse();
            assertThat(consumer.closed()).isTrue();
        }

        @Test
        @DisplayName("close during a retry wait still commits records dead-lettered earlier in the batch")
        void closeCommitsTerminalRecords() throws Exception {
            runUntilClosedDuringRetry(false);

            assertThat(publisher.acknowledged).hasSize(1);
            assertThat(publisher.acknowledged.get(0).original().offset()).isZero();
            assertThat(consumer.lastCommitted).containsEntry(P0, 1L);
        }

        @Test
        @DisplayName("a wakeup pending at commit time does not drop the commit")
        void wakeupAtCommitRetriesCommit() throws Exception {
            runUntilClosedDuringRetry(true);

            assertThat(publisher.acknowledged).hasSize(1);
            assertThat(consumer.lastCommitted).containsEntry(P0, 1L);
        }

        /**
         * Offset 0 fails validation and is dead-lettered; offset 1 fails while the loop is being closed.
         */
        private void runUntilClosedDuringRetry(boolean wakeupBeforeCommit) throws Exception {
            AtomicReference<RecoveryCoordinator> coordinator = new AtomicReference<>();
            AtomicReference<ConsumerLoopAdapter> loop = new AtomicReference<>();
            coordinator.set(RecoveryCoordinator.builder()
                    .config(config())
                    .handler(m -> {
                        if (m.offset() == 0) {
                            throw new ValidationException("amount", "must be positive");
                        }
                        Thread closer = new Thread(() -> loop.get().close(), "closer");
                        closer.start();
                        await().atMost(Duration.ofSeconds(5)).until(() -> coordinator.get().isShuttingDown());
                        if (wakeupBeforeCommit) {
                            // close() woke the consumer just as poll returned
                            consumer.wakeup();
                        }
                        throw new TransientProcessingException("inventory unavailable");
                    })
                    .publisher(publisher)
                    .build());
            adapter = new ConsumerLoopAdapter(consumer, coordinator.get(), config(), List.of("orders"));
            loop.set(adapter);
            consumer.schedulePollTask(() -> {
                consumer.updateBeginningOffsets(Map.of(P0, 0L));
                consumer.rebalance(List.of(P0));
                addRecord(P0, 0, "a");
                addRecord(P0, 1, "b");
            });

            Thread runner = new Thread(adapter::run, "consumer-loop");
            runner.start();
            runner.join(10_000);

            assertThat(runner.isAlive()).isFalse();
            assertThat(consumer.closed()).isTrue();
        }

        @Test
        @DisplayName("a crashed loop no longer reports running")
        void crashedLoopNotRunning() {
            ConsumerLoopAdapter loop = adapter(m -> { });
            consumer.setPollException(new KafkaException("fatal fetch error"));

            assertThatThrownBy(loop::run).isInstanceOf(KafkaException.class);

            assertThat(loop.isRunning()).isFalse();
            assertThat(consumer.closed()).isTrue();
        }

        @Test
        @DisplayName("close without run closes the consumer")
        void closeWithoutRun() {
            ConsumerLoopAdapter loop = adapter(m -> { });

            loop.close();

            assertThat(consumer.closed()).isTrue();
            assertThatThrownBy(loop::run).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Commit failures")
    class CommitFailures {

        @Test
        @DisplayName("a rejected commit is logged and polling continues")
        void rejectedCommitKeepsPolling() throws Exception {
            List<Long> handled = new CopyOnWriteArrayList<>();
            ConsumerLoopAdapter loop = adapter(m -> handled.add(m.offset()));
            consumer.rejectNextCommits(1);
            consumer.schedulePollTask(() -> {
                consumer.updateBeginningOffsets(Map.of(P0, 0L));
                consumer.rebalance(List.of(P0));
                addRecord(P0, 0, "a");
            });
            consumer.schedulePollTask(() -> addRecord(P0, 1, "b"));

            Thread runner = new Thread(loop::run, "consumer-loop");
            runner.start();

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
                assertThat(handled).containsExactly(0L, 1L);
                assertThat(consumer.lastCommitted).containsEntry(P0, 2L);
            });
            assertThat(runner.isAlive()).isTrue();
            assertThat(loop.isRunning()).isTrue();

            loop.close();
            runner.join(5000);
            assertThat(runner.isAlive()).isFalse();
        }
    }
}
