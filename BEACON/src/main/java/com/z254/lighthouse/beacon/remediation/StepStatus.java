package com.z254.lighthouse.beacon.remediation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a single remediation step.
 */
public enum StepStatus {
    PENDING("pending"),
    APPLIED("applied"),
    SKIPPED("skipped"),
    FAILED("failed");

    private final String code;

    StepStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Status of a step the playbook can carry out right away: proposed only in a dry run.
     */
    public static StepStatus immediate(boolean dryRun) {
        return dryRun ? PENDING : APPLIED;
    }
}
