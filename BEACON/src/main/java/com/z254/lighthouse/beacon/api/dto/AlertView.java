package com.z254.lighthouse.beacon.api.dto;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import lombok.Builder;
import lombok.Data;

/**
 * Lifecycle state of one alert together with its most recently surfaced payload.
 */
@Data
@Builder
public class AlertView {
    private AlertState state;
    private Alert latest;
    private int occurrences;
}
