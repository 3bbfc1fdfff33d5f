package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.remediation.EstimatedImpact;
import com.z254.lighthouse.beacon.remediation.RemediationStep;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the configured guardrails to every step of a plan.
 * <p>
 * Each step is checked by every guardrail. A blocking failure marks the step
 * {@code skipped} with the guardrail messages, joined by {@code "; "}, as reason; sibling
 * steps are unaffected.
 * A guardrail that throws aborts the evaluation.
 */
@Slf4j
public class GuardrailEvaluator {

    private final List<Guardrail> guardrails;

    public GuardrailEvaluator(List<Guardrail> guardrails) {
        this.guardrails = List.copyOf(guardrails);
    }

    public GuardrailVerdict evaluate(List<RemediationStep> steps, EstimatedImpact impact, Entity entity) {
        List<String> blockers = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> blockedBy = new ArrayList<>();
        Double estimatedCost = impact != null ? impact.getCost() : null;

        for (RemediationStep step : steps) {
            ProposedAction action = new ProposedAction(step.getAction(), step.getParams(), estimatedCost, entity);
            List<String> stepBlockers = new ArrayList<>();
            for (Guardrail guardrail : guardrails) {
                GuardrailResult result = guardrail.check(action);
                if (result.passed()) {
                    continue;
                }
                String message = guardrail.getName() + ": " + result.reason();
                if (guardrail.isCritical() || result.blocker()) {
                    blockers.add(message);
                    blockedBy.add(guardrail.getName());
                    stepBlockers.add(message);
                    log.debug("Step {} blocked by {}", step.getAction(), guardrail.getName());
                } else {
                    warnings.add(message);
                }
            }
            if (!stepBlockers.isEmpty()) {
                step.skip(String.join("; ", stepBlockers));
            }
        }
        return new GuardrailVerdict(blockers, warnings, blockedBy);
    }

    public List<Guardrail> getGuardrails() {
        return guardrails;
    }
}
