package com.z254.lighthouse.beacon.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One action in a remediation plan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationStep {

    private String action;

    @Builder.Default
    private Map<String, Object> params = new LinkedHashMap<>();

    /** Artifact the step produced, such as a generated file name */
    private String output;

    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    /** Why the step was skipped or failed */
    private String reason;

    public void skip(String reason) {
        this.status = StepStatus.SKIPPED;
        this.reason = reason;
    }

    public static RemediationStep of(String action, Map<String, Object> params, StepStatus status) {
        return RemediationStep.builder()
                .action(action)
                .params(new LinkedHashMap<>(params))
                .status(status)
                .build();
    }
}
