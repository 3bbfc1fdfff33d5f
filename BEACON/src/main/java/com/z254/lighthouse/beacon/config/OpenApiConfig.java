package com.z254.lighthouse.beacon.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for BEACON.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8086}")
    private int serverPort;

    @Bean
    public OpenAPI beaconOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("BEACON Anomaly Detection API")
                        .description("""
                                BEACON watches paid search entities for performance anomalies.

                                ## Features

                                - **Detection**: CTR, CPC, spend, conversion, quality score and landing page checks
                                - **Noise control**: consecutive-check debounce and cooldowns per alert
                                - **Lifecycle**: acknowledge, snooze and close alerts
                                - **Remediation**: playbook plans evaluated against guardrails, dry run by default
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")))
                .tags(List.of(
                        new Tag()
                                .name("Alerts")
                                .description("Alert scanning, lifecycle and remediation")));
    }
}
