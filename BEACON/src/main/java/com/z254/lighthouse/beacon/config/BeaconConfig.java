package com.z254.lighthouse.beacon.config;

import com.z254.lighthouse.beacon.remediation.guardrail.Guardrail;
import com.z254.lighthouse.beacon.remediation.guardrail.GuardrailEvaluator;
import com.z254.lighthouse.beacon.remediation.guardrail.ThresholdGuardrail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Core wiring: the clock every time-dependent component reads and the guardrail set.
 */
@Slf4j
@Configuration
public class BeaconConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Policy guardrail beans plus one threshold guardrail per configured definition.
     */
    @Bean
    public GuardrailEvaluator guardrailEvaluator(List<Guardrail> policies, BeaconProperties properties) {
        List<Guardrail> guardrails = new ArrayList<>(policies);
        properties.getRemediation().getGuardrails().stream()
                .map(ThresholdGuardrail::from)
                .forEach(guardrails::add);
        log.info("Guardrails active: {}", guardrails.stream().map(Guardrail::getName).toList());
        return new GuardrailEvaluator(guardrails);
    }
}
