package com.aporkolab.redelivery.spring.autoconfigure;

import java.util.Map;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.util.StringUtils;

import com.aporkolab.redelivery.core.DeadLetterPublisher;
import com.aporkolab.redelivery.core.DeadLetterReplayer;
import com.aporkolab.redelivery.core.ErrorClassifier;
import com.aporkolab.redelivery.core.KafkaDeadLetterPublisher;
import com.aporkolab.redelivery.core.MessageHandler;
import com.aporkolab.redelivery.core.MessageValidator;
import com.aporkolab.redelivery.core.RecoveryCoordinator;
import com.aporkolab.redelivery.core.RecoveryListener;
import com.aporkolab.redelivery.core.RedeliveryConfig;
import com.aporkolab.redelivery.metrics.RedeliveryMetrics;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Spring Boot Auto-Configuration for Kafka redelivery.
 *
 * Automatically configures:
 * - RedeliveryConfig bound from redelivery.* properties
 * - Byte-array dead-letter producer (acks=all, idempotent) and publisher
 * - Dead-letter replayer
 * - RedeliveryMetrics when a MeterRegistry is present
 * - RecoveryCoordinator when the application defines a MessageHandler bean
 * - Consumer loop lifecycle when redelivery.consumer.topics is set
 *
 * Broker connection settings come from spring.kafka.*.
 * Disable with: redelivery.enabled=false
 */
@AutoConfiguration(
        after = KafkaAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
        })
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties({RedeliveryProperties.class, KafkaProperties.class})
@ConditionalOnProperty(prefix = "redelivery", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedeliveryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RedeliveryConfig redeliveryConfig(RedeliveryProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier redeliveryErrorClassifier(RedeliveryConfig config) {
        return config.errorClassifier();
    }

    // ==================== DEAD-LETTER PRODUCER ====================

    @Bean
    @ConditionalOnMissingBean(name = "deadLetterProducerFactory")
    public ProducerFactory<byte[], byte[]> deadLetterProducerFactory(KafkaProperties kafkaProperties) {
        Map<String, Object> props = kafkaProperties.buildProducerProperties(null);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        // a dead-letter write is the only copy of the message once the source offset is committed
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    @ConditionalOnMissingBean(name = "deadLetterKafkaTemplate")
    public KafkaTemplate<byte[], byte[]> deadLetterKafkaTemplate(
            @Qualifier("deadLetterProducerFactory") ProducerFactory<byte[], byte[]> deadLetterProducerFactory) {
        return new KafkaTemplate<>(deadLetterProducerFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterPublisher deadLetterPublisher(
            @Qualifier("deadLetterKafkaTemplate") KafkaTemplate<byte[], byte[]> deadLetterKafkaTemplate) {
        return new KafkaDeadLetterPublisher(deadLetterKafkaTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterReplayer deadLetterReplayer(
            @Qualifier("deadLetterKafkaTemplate") KafkaTemplate<byte[], byte[]> deadLetterKafkaTemplate,
            RedeliveryConfig config) {
        return new DeadLetterReplayer(deadLetterKafkaTemplate, config.publishTimeout());
    }

    // ==================== COORDINATOR ====================

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnBean(MessageHandler.class)
    @ConditionalOnMissingBean
    public RecoveryCoordinator recoveryCoordinator(RedeliveryConfig config,
                                                   ErrorClassifier redeliveryErrorClassifier,
                                                   MessageHandler handler,
                                                   ObjectProvider<MessageValidator> validator,
                                                   DeadLetterPublisher deadLetterPublisher,
                                                   ObjectProvider<RecoveryListener> listeners) {
        RecoveryCoordinator.Builder builder = RecoveryCoordinator.builder()
                .config(config)
                .classifier(redeliveryErrorClassifier)
                .handler(handler)
                .publisher(deadLetterPublisher);
        validator.ifAvailable(builder::validator);
        listeners.orderedStream().forEach(builder::listener);
        return builder.build();
    }

    // ==================== CONSUMER LOOP ====================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(MessageHandler.class)
    @ConditionalOnProperty(prefix = "redelivery.consumer", name = "topics")
    static class ConsumerLoopConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "redeliveryConsumerFactory")
        public ConsumerFactory<byte[], byte[]> redeliveryConsumerFactory(KafkaProperties kafkaProperties,
                                                                       RedeliveryProperties properties,
                                                                       RedeliveryConfig config) {
            Map<String, Object> props = kafkaProperties.buildConsumerProperties(null);
            props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
            props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
            props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
            props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, (int) config.maxPollInterval().toMillis());
            props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, config.maxPollRecords());
            if (StringUtils.hasText(properties.getConsumer().getGroupId())) {
                props.put(ConsumerConfig.GROUP_ID_CONFIG, properties.getConsumer().getGroupId());
            }
            return new DefaultKafkaConsumerFactory<>(props);
        }

        @Bean
        @ConditionalOnMissingBean
        public RedeliveryConsumerRunner redeliveryConsumerRunner(
                @Qualifier("redeliveryConsumerFactory") ConsumerFactory<byte[], byte[]> redeliveryConsumerFactory,
                KafkaProperties kafkaProperties,
                RedeliveryProperties properties,
                RedeliveryConfig config,
                RecoveryCoordinator coordinator) {
            return new RedeliveryConsumerRunner(
                    redeliveryConsumerFactory::createConsumer,
                    properties.getDeadLetter().isProvisionTopics()
                            ? () -> Admin.create(kafkaProperties.buildAdminProperties(null))
                            : null,
                    coordinator,
                    config,
                    properties.getConsumer().getTopics());
        }
    }

    // ==================== METRICS ====================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MeterRegistry.class, RedeliveryMetrics.class})
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "redelivery.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RedeliveryMetrics redeliveryMetrics(MeterRegistry registry, RedeliveryProperties properties) {
            return new RedeliveryMetrics(registry, properties.getMetrics().getName());
        }
    }
}
