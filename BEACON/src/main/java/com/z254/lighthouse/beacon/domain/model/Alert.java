package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A surfaced anomaly.
 * <p>
 * The identifier is a deterministic fingerprint of the alert type and entity coordinates,
 * so the same anomaly on the same entity always maps to the same persisted state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Alert {

    private String id;

    private AlertType type;

    private Severity severity;

    private Entity entity;

    private TimeWindow window;

    private AlertMetrics metrics;

    /** Human readable explanation */
    private String why;

    /** Playbook identifier, {@code pb_<type>} unless overridden */
    private String playbook;

    @Builder.Default
    private List<SuggestedAction> suggestedActions = new ArrayList<>();

    private Detection detection;

    /**
     * Playbook to run for this alert, falling back to the type default.
     */
    public String resolvePlaybookId() {
        if (playbook != null && !playbook.isBlank()) {
            return playbook;
        }
        return type.defaultPlaybookId();
    }
}
