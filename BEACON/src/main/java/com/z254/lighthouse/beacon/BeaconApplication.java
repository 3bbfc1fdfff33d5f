package com.z254.lighthouse.beacon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * BEACON - ad performance anomaly detection and remediation engine.
 *
 * <p>BEACON provides:
 * <ul>
 *   <li>Detection - Baseline vs current comparisons per entity and alert type</li>
 *   <li>Noise Control - Consecutive-detection debounce and cooldown per alert</li>
 *   <li>Alert Lifecycle - Acknowledge, snooze and close with persisted state</li>
 *   <li>Remediation - Playbook plans checked step by step against guardrails</li>
 * </ul>
 *
 * <p>Surfaced alerts, scan batches and applied remediations are published to Kafka.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class BeaconApplication {

    public static void main(String[] args) {
        SpringApplication.run(BeaconApplication.class, args);
    }
}
