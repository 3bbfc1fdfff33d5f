package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Persisted lifecycle status of an alert.
 */
public enum AlertStatus {
    OPEN("open"),
    ACK("ack"),
    SNOOZED("snoozed"),
    CLOSED("closed");

    private final String code;

    AlertStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AlertStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown alert status: " + code));
    }
}
