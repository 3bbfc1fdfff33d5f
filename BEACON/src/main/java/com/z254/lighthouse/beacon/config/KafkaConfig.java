package com.z254.lighthouse.beacon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka configuration for BEACON producers.
 * <p>
 * Provides:
 * <ul>
 *     <li>JSON producer factory with idempotent configuration</li>
 *     <li>Topic definitions for BEACON events</li>
 * </ul>
 */
@Configuration
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final BeaconProperties beaconProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, BeaconProperties beaconProperties) {
        this.kafkaProperties = kafkaProperties;
        this.beaconProperties = beaconProperties;
    }

    // ==================== Producer Configuration ====================

    /**
     * JSON producer factory sharing the application's ObjectMapper, so events carry the same
     * field names and date format as the REST API.
     */
    @Bean
    public ProducerFactory<String, Object> producerFactory(ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));

        // Idempotent producer configuration
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        // Retry configuration
        props.put(ProducerConfig.RETRIES_CONFIG, Integer.MAX_VALUE);
        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 100);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        // Detection must not stall on an unreachable broker
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, 5000);

        // Batching for efficiency
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, 16384);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        JsonSerializer<Object> valueSerializer = new JsonSerializer<>(objectMapper);
        valueSerializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> producerFactory) {
        KafkaTemplate<String, Object> template = new KafkaTemplate<>(producerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    // ==================== Topic Configuration ====================

    @Bean
    public NewTopic alertsSurfacedTopic() {
        return TopicBuilder.name(beaconProperties.getKafka().getTopics().getAlertsSurfaced())
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic alertBatchesTopic() {
        return TopicBuilder.name(beaconProperties.getKafka().getTopics().getAlertBatches())
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic remediationsAppliedTopic() {
        return TopicBuilder.name(beaconProperties.getKafka().getTopics().getRemediationsApplied())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
