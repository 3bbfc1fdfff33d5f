package com.z254.lighthouse.beacon.remediation;

import java.util.List;

/**
 * Append-only record of remediations that were actually applied.
 */
public interface RemediationLog {

    void append(RemediationLogEntry entry);

    List<RemediationLogEntry> findByAlertId(String alertId);

    List<RemediationLogEntry> findAll();
}
