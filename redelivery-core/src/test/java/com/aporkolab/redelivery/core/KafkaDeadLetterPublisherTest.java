package com.aporkolab.redelivery.core;

import static com.aporkolab.redelivery.core.TestMessages.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.StreamSupport;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.NotEnoughReplicasException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaProducerException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.aporkolab.redelivery.exception.DeliveryException;

@ExtendWith(MockitoExtension.class)
class KafkaDeadLetterPublisherTest {

    @Mock
    private KafkaTemplate<byte[], byte[]> kafkaTemplate;

    private KafkaDeadLetterPublisher publisher;
    private DeadLetterRecord record;

    @BeforeEach
    void setUp() {
        publisher = new KafkaDeadLetterPublisher(kafkaTemplate);
        Message message = Message.builder()
                .key(utf8("order-1"))
                .value(utf8("{\"orderId\":\"U2\"}"))
                .sourceTopic("orders")
                .sourcePartition(1)
                .offset(5)
                .header("trace", "a")
                .header("trace", "b")
                .build();
        record = new DeadLetterRouter(ErrorClassifier.defaults()).route(message, new RuntimeException("boom"), 2);
    }

    @Nested
    @DisplayName("Successful publish")
    class SuccessfulPublish {

        @Test
        @DisplayName("should write key, value, partition and every header")
        @SuppressWarnings("unchecked")
        void writesRecord() throws Exception {
            mockKafkaSend();

            RecordMetadata metadata = publisher.publish(record).get();

            ArgumentCaptor<ProducerRecord<byte[], byte[]>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
            verify(kafkaTemplate).send(captor.capture());
            ProducerRecord<byte[], byte[]> sent = captor.getValue();

            assertThat(metadata.topic()).isEqualTo("orders.dlt");
            assertThat(sent.topic()).isEqualTo("orders.dlt");
            assertThat(sent.partition()).isZero();
            assertThat(sent.key()).isEqualTo(utf8("order-1"));
            assertThat(sent.value()).isEqualTo(utf8("{\"orderId\":\"U2\"}"));

            List<String> keys = StreamSupport.stream(sent.headers().spliterator(), false)
                    .map(Header::key)
                    .toList();
            assertThat(keys).startsWith("trace", "trace");
            assertThat(keys.subList(2, keys.size())).containsExactlyElementsOf(DeadLetterHeaders.PROVENANCE);
            assertThat(new String(sent.headers().lastHeader(DeadLetterHeaders.ATTEMPT_COUNT).value())).isEqualTo("2");
        }
    }

    @Nested
    @DisplayName("Failed publish")
    class FailedPublish {

        @Test
        @DisplayName("unknown topic is reported as missing destination")
        void unknownTopic() {
            when(kafkaTemplate.send(any(ProducerRecord.class)))
                    .thenReturn(CompletableFuture.failedFuture(
                            new KafkaException("send failed", new UnknownTopicOrPartitionException("orders.dlt"))));

            DeliveryException error = failure(publisher.publish(record));

            assertThat(error.isDestinationMissing()).isTrue();
            assertThat(error.getContext()).containsEntry("destination", "orders.dlt");
        }

        @Test
        @DisplayName("metadata timeout for an absent topic is reported as missing destination")
        void metadataTimeout() {
            when(kafkaTemplate.send(any(ProducerRecord.class)))
                    .thenReturn(CompletableFuture.failedFuture(
                            new TimeoutException("Topic orders.dlt not present in metadata after 60000 ms.")));

            assertThat(failure(publisher.publish(record)).isDestinationMissing()).isTrue();
        }

        @Test
        @DisplayName("other broker errors are plain delivery failures")
        @SuppressWarnings("unchecked")
        void otherErrors() {
            ProducerRecord<byte[], byte[]> producerRecord = KafkaDeadLetterPublisher.toProducerRecord(record);
            when(kafkaTemplate.send(any(ProducerRecord.class)))
                    .thenReturn(CompletableFuture.failedFuture(new KafkaProducerException(producerRecord, "not enough replicas",
                            new NotEnoughReplicasException("isr"))));

            DeliveryException error = failure(publisher.publish(record));

            assertThat(error.isDestinationMissing()).isFalse();
            assertThat(error.getCode()).isEqualTo("DEAD_LETTER_DELIVERY_ERROR");
        }

        @Test
        @DisplayName("synchronous send failure completes the future exceptionally")
        void synchronousFailure() {
            when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new IllegalStateException("producer closed"));

            assertThat(failure(publisher.publish(record)).getCause()).isInstanceOf(IllegalStateException.class);
        }
    }

    private static DeliveryException failure(CompletableFuture<RecordMetadata> future) {
        assertThatThrownBy(future::get).isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DeliveryException.class);
        return (DeliveryException) future.handle((ok, ex) -> ex).join();
    }

    @SuppressWarnings("unchecked")
    private void mockKafkaSend() {
        SendResult<byte[], byte[]> sendResult = mock(SendResult.class);
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("orders.dlt", 0), 0L, 0, 0L, 0, 0);
        when(sendResult.getRecordMetadata()).thenReturn(metadata);
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.completedFuture(sendResult));
    }
}
