package com.z254.lighthouse.beacon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A follow-up the detector recommends alongside the alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestedAction {

    private String action;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    public static SuggestedAction of(String action, Map<String, Object> params) {
        return new SuggestedAction(action, new LinkedHashMap<>(params));
    }
}
