package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.domain.model.Entity;

import java.util.Map;

/**
 * What a guardrail is asked to judge: one step of a plan.
 *
 * @param type          the step action
 * @param params        the step parameters
 * @param estimatedCost the plan's estimated cost impact, null when unknown
 * @param entity        the entity the alert was raised on
 */
public record ProposedAction(String type, Map<String, Object> params, Double estimatedCost, Entity entity) {

    public ProposedAction {
        params = params == null ? Map.of() : params;
    }

    public Object param(String key) {
        return params.get(key);
    }

    public Double numericParam(String key) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }
}
