package com.z254.lighthouse.beacon.kafka;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertBatch;
import com.z254.lighthouse.beacon.remediation.Remediation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Kafka producer for alert and remediation events. Publishing is best effort: failures are
 * logged and never reach the caller.
 */
@Slf4j
@Component
public class AlertEventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final BeaconProperties beaconProperties;

    public AlertEventProducer(KafkaTemplate<String, Object> kafkaTemplate,
                              BeaconProperties beaconProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.beaconProperties = beaconProperties;
    }

    /**
     * Emit a surfaced alert keyed by alert id.
     */
    public void publishAlert(Alert alert) {
        send(beaconProperties.getKafka().getTopics().getAlertsSurfaced(), alert.getId(), alert, "alert");
    }

    /**
     * Emit a scan batch keyed by product.
     */
    public void publishBatch(AlertBatch batch) {
        send(beaconProperties.getKafka().getTopics().getAlertBatches(), batch.getProduct(), batch, "alert batch");
    }

    /**
     * Emit an applied remediation keyed by alert id.
     */
    public void publishRemediation(Remediation remediation) {
        send(beaconProperties.getKafka().getTopics().getRemediationsApplied(), remediation.getAlertId(),
                remediation, "remediation");
    }

    private void send(String topic, String key, Object payload, String kind) {
        if (!beaconProperties.getKafka().isEnabled()) {
            log.debug("Kafka publishing disabled, dropping {} event key={}", kind, key);
            return;
        }
        try {
            kafkaTemplate.send(topic, key, payload)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to emit {} event: key={}, error={}", kind, key, ex.getMessage());
                        } else {
                            log.info("Emitted {} event: key={}, topic={}, partition={}", kind, key, topic,
                                    result.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Failed to emit {} event: key={}, error={}", kind, key, e.getMessage());
        }
    }
}
