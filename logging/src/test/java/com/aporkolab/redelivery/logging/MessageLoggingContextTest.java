package com.aporkolab.redelivery.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MessageLoggingContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("should expose message provenance in MDC")
    void shouldPopulateMdc() {
        try (MessageLoggingContext ctx = MessageLoggingContext.open("orders", 2, 42L, "corr-1")) {
            assertThat(MDC.get(MessageLoggingContext.TOPIC_KEY)).isEqualTo("orders");
            assertThat(MDC.get(MessageLoggingContext.PARTITION_KEY)).isEqualTo("2");
            assertThat(MDC.get(MessageLoggingContext.OFFSET_KEY)).isEqualTo("42");
            assertThat(MessageLoggingContext.getCurrentCorrelationId()).isEqualTo("corr-1");
        }
    }

    @Test
    @DisplayName("should generate correlation id when header is missing")
    void shouldGenerateCorrelationId() {
        try (MessageLoggingContext ctx = MessageLoggingContext.open("orders", 0, 0L, null)) {
            assertThat(MessageLoggingContext.getCurrentCorrelationId()).hasSize(16);
        }
    }

    @Test
    @DisplayName("should restore previous context on close")
    void shouldRestorePreviousContext() {
        MDC.put("service", "order-consumer");

        try (MessageLoggingContext ctx = MessageLoggingContext.open("orders", 0, 7L, "c").attempt(2)) {
            assertThat(MDC.get(MessageLoggingContext.ATTEMPT_KEY)).isEqualTo("2");
        }

        assertThat(MDC.get("service")).isEqualTo("order-consumer");
        assertThat(MDC.get(MessageLoggingContext.TOPIC_KEY)).isNull();
        assertThat(MDC.get(MessageLoggingContext.ATTEMPT_KEY)).isNull();
    }

    @Test
    @DisplayName("should clear MDC on close when nothing was set before")
    void shouldClearWhenNoPreviousContext() {
        try (MessageLoggingContext ctx = MessageLoggingContext.open("orders", 0, 1L, "c")) {
            assertThat(MDC.getCopyOfContextMap()).isNotEmpty();
        }

        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }

    @Test
    @DisplayName("should propagate context into worker threads")
    void shouldPropagateToWorkers() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try (MessageLoggingContext ctx = MessageLoggingContext.open("orders", 1, 5L, "propagated")) {
            Callable<String> task = MessageLoggingContext.wrap(MessageLoggingContext::getCurrentCorrelationId);

            assertThat(executor.submit(task).get()).isEqualTo("propagated");
        } finally {
            executor.shutdown();
        }
    }
}
