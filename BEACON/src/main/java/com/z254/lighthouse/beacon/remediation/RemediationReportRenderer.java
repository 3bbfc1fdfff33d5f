package com.z254.lighthouse.beacon.remediation;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Plain-text rendering of a remediation for operators.
 */
@Component
public class RemediationReportRenderer {

    public String render(Remediation remediation) {
        StringBuilder sb = new StringBuilder();
        sb.append("Remediation Report\n");
        sb.append("==================\n");
        sb.append("Alert: ").append(remediation.getAlertId()).append('\n');
        sb.append("Playbook: ").append(remediation.getPlaybook()).append('\n');
        sb.append("Mode: ").append(remediation.isDryRun() ? "dry run" : "apply").append('\n');
        sb.append("Guardrails: ").append(remediation.isGuardrailsPassed() ? "PASSED" : "BLOCKED").append('\n');

        if (!remediation.getBlockers().isEmpty()) {
            sb.append("\nBlockers:\n");
            remediation.getBlockers().forEach(b -> sb.append("  - ").append(b).append('\n'));
        }
        if (!remediation.getWarnings().isEmpty()) {
            sb.append("\nWarnings:\n");
            remediation.getWarnings().forEach(w -> sb.append("  - ").append(w).append('\n'));
        }

        sb.append("\nSteps:\n");
        if (remediation.getSteps().isEmpty()) {
            sb.append("  (none)\n");
        }
        int index = 1;
        for (RemediationStep step : remediation.getSteps()) {
            sb.append("  ").append(index++).append(". ").append(step.getAction())
                    .append(" [").append(step.getStatus().getCode()).append("]\n");
            for (Map.Entry<String, Object> param : step.getParams().entrySet()) {
                sb.append("       ").append(param.getKey()).append(": ").append(param.getValue()).append('\n');
            }
            if (step.getOutput() != null) {
                sb.append("       output: ").append(step.getOutput()).append('\n');
            }
            if (step.getReason() != null) {
                sb.append("       reason: ").append(step.getReason()).append('\n');
            }
        }

        EstimatedImpact impact = remediation.getEstimatedImpact();
        if (impact != null) {
            sb.append("\nEstimated impact:\n");
            appendImpact(sb, "cost", impact.getCost());
            appendImpact(sb, "impressions", impact.getImpressions());
            appendImpact(sb, "clicks", impact.getClicks());
            appendImpact(sb, "conversions", impact.getConversions());
        }
        return sb.toString();
    }

    private static void appendImpact(StringBuilder sb, String label, Double value) {
        if (value != null) {
            sb.append("  ").append(label).append(": ").append(String.format("%.2f", value)).append('\n');
        }
    }
}
