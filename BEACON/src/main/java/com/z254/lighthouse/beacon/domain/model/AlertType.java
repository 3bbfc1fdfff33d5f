package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Anomaly categories raised by the detectors. The code is the wire value and the
 * suffix of the default playbook identifier.
 */
public enum AlertType {
    SPEND_SPIKE("spend_spike"),
    SPEND_DROP("spend_drop"),
    CPC_JUMP("cpc_jump"),
    CTR_DROP("ctr_drop"),
    CONVERSION_DROP("conversion_drop"),
    QUALITY_SCORE("quality_score"),
    LP_REGRESSION("lp_regression");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Playbook identifier used when an alert does not name one explicitly.
     */
    public String defaultPlaybookId() {
        return "pb_" + code;
    }

    /**
     * Resolve a type from its code. Kebab-case keys from configuration are accepted too.
     */
    @JsonCreator
    public static AlertType fromCode(String code) {
        String normalized = code == null ? "" : code.trim().replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown alert type: " + code));
    }
}
