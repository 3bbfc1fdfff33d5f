package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Alert severity, ordered from most to least urgent.
 */
public enum Severity {
    CRITICAL("critical", 0),
    HIGH("high", 1),
    MEDIUM("medium", 2),
    LOW("low", 3);

    private final String code;
    private final int rank;

    Severity(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /** 0 is the most urgent */
    public int getRank() {
        return rank;
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || rank < other.rank;
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + code));
    }
}
