package com.z254.lighthouse.beacon.api.dto;

import com.z254.lighthouse.beacon.domain.model.AlertState;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for alert state listings.
 */
@Data
@Builder
public class AlertListResponse {
    private List<AlertState> alerts;
    private long total;
    private int page;
    private int size;
}
