package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of a detection run over a set of entities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertBatch {

    private Instant generatedAt;

    private String product;

    @Builder.Default
    private List<Alert> alerts = new ArrayList<>();

    private Summary summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Summary {
        private int total;
        private int critical;
        private int high;
        private int medium;
        private int low;
        /** Alerts with no history older than 24 hours */
        @JsonProperty("new")
        private int newAlerts;
        private int persistent;
    }
}
