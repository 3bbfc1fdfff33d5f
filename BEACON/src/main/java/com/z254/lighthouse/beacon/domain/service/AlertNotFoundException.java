package com.z254.lighthouse.beacon.domain.service;

/**
 * Raised when an operation names an alert identifier with no stored state.
 */
public class AlertNotFoundException extends RuntimeException {

    public AlertNotFoundException(String alertId) {
        super("Alert not found: " + alertId);
    }
}
