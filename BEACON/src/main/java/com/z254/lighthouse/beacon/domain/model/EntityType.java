package com.z254.lighthouse.beacon.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind of advertising object an alert is raised against.
 */
public enum EntityType {
    CAMPAIGN("campaign"),
    AD_GROUP("ad_group"),
    KEYWORD("keyword"),
    URL("url"),
    CLUSTER("cluster");

    private final String code;

    EntityType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static EntityType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + code));
    }
}
