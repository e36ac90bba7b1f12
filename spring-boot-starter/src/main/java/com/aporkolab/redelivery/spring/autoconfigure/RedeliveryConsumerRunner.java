package com.aporkolab.redelivery.spring.autoconfigure;

import java.util.List;
import java.util.function.Supplier;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.consumer.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import com.aporkolab.redelivery.core.ConsumerLoopAdapter;
import com.aporkolab.redelivery.core.DeadLetterTopicProvisioner;
import com.aporkolab.redelivery.core.RecoveryCoordinator;
import com.aporkolab.redelivery.core.RedeliveryConfig;

/**
 * Runs a {@link ConsumerLoopAdapter} on its own thread for the lifetime of the application context.
 *
 * On start, optionally provisions the dead-letter topics. On stop, cancels pending retries
 * and closes the consumer; abandoned records are redelivered after restart.
 */
public class RedeliveryConsumerRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RedeliveryConsumerRunner.class);

    private final Supplier<Consumer<byte[], byte[]>> consumerFactory;
    private final Supplier<Admin> adminFactory;
    private final RecoveryCoordinator coordinator;
    private final RedeliveryConfig config;
    private final List<String> topics;

    private volatile ConsumerLoopAdapter adapter;
    private volatile Thread loopThread;

    /**
     * @param adminFactory null to skip dead-letter topic provisioning
     */
    public RedeliveryConsumerRunner(Supplier<Consumer<byte[], byte[]>> consumerFactory, Supplier<Admin> adminFactory,
                                    RecoveryCoordinator coordinator, RedeliveryConfig config, List<String> topics) {
        this.consumerFactory = consumerFactory;
        this.adminFactory = adminFactory;
        this.coordinator = coordinator;
        this.config = config;
        this.topics = List.copyOf(topics);
    }

    @Override
    public void start() {
        if (adminFactory != null) {
            try (Admin admin = adminFactory.get()) {
                new DeadLetterTopicProvisioner(admin, config).provision(topics);
            }
        }

        Consumer<byte[], byte[]> consumer = consumerFactory.get();
        try {
            adapter = new ConsumerLoopAdapter(consumer, coordinator, config, topics);
        } catch (RuntimeException e) {
            consumer.close();
            throw e;
        }

        Thread thread = new Thread(adapter::run, "redelivery-consumer-loop");
        thread.setUncaughtExceptionHandler((t, e) -> log.error("Redelivery consumer loop failed: {}", e.getMessage(), e));
        loopThread = thread;
        thread.start();
        log.info("Redelivery consumer started for topics {}", topics);
    }

    @Override
    public void stop() {
        ConsumerLoopAdapter current = adapter;
        if (current == null) {
            return;
        }
        coordinator.shutdown();
        current.close();
        adapter = null;
        loopThread = null;
        log.info("Redelivery consumer stopped");
    }

    /**
     * False once the loop thread has died, even if {@link #stop()} was never called.
     */
    @Override
    public boolean isRunning() {
        Thread thread = loopThread;
        return adapter != null && thread != null && thread.isAlive();
    }

    Thread getLoopThread() {
        return loopThread;
    }
}
