package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.domain.model.Alert;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one detector evaluation. A triggered result carries the alert; anything else
 * carries the reason it did not trigger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectorResult {

    private boolean triggered;

    private Alert alert;

    private String reason;

    public static DetectorResult triggered(Alert alert) {
        return new DetectorResult(true, alert, null);
    }

    public static DetectorResult notTriggered(String reason) {
        return new DetectorResult(false, null, reason);
    }
}
