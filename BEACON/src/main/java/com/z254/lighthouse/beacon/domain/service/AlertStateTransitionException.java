package com.z254.lighthouse.beacon.domain.service;

import com.z254.lighthouse.beacon.domain.model.AlertStatus;

/**
 * Raised when a lifecycle operation is not allowed from the alert's current status.
 */
public class AlertStateTransitionException extends RuntimeException {

    public AlertStateTransitionException(String alertId, AlertStatus from, String operation) {
        super(String.format("Cannot %s alert %s while %s", operation, alertId, from.getCode()));
    }
}
