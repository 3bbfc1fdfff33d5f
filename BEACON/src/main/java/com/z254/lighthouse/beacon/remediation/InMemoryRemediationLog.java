package com.z254.lighthouse.beacon.remediation;

import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Basic in-memory remediation log used until a durable audit store is wired up.
 */
@Repository
public class InMemoryRemediationLog implements RemediationLog {

    private final List<RemediationLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(RemediationLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<RemediationLogEntry> findByAlertId(String alertId) {
        return entries.stream()
                .filter(e -> alertId.equals(e.getAlertId()))
                .toList();
    }

    @Override
    public List<RemediationLogEntry> findAll() {
        return List.copyOf(entries);
    }
}
