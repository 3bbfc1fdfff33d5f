package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.config.AlertConfig;
import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;

/**
 * Evaluates one anomaly type against one entity.
 * <p>
 * Implementations never throw: failures are reported as a non-triggered result whose reason
 * starts with {@code "Detection error: "}.
 */
public interface Detector {

    AlertType getType();

    AlertConfig getConfig();

    /**
     * @param window comparison windows, or null to use the detector's configured windows
     */
    DetectorResult detect(Entity entity, TimeWindow window);
}
