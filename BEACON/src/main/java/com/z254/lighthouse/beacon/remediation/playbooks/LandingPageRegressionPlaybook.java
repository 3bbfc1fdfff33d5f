package com.z254.lighthouse.beacon.remediation.playbooks;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.remediation.EstimatedImpact;
import com.z254.lighthouse.beacon.remediation.Playbook;
import com.z254.lighthouse.beacon.remediation.PlaybookOptions;
import com.z254.lighthouse.beacon.remediation.PlaybookPlan;
import com.z254.lighthouse.beacon.remediation.RemediationStep;
import com.z254.lighthouse.beacon.remediation.StepStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stops traffic to broken pages first, then lines up the fixes. Blocking applies happens even
 * in a dry run.
 */
@Component
public class LandingPageRegressionPlaybook implements Playbook {

    @Override
    public String getId() {
        return "pb_lp_regression";
    }

    @Override
    public String getDescription() {
        return "Fix landing page issues and block traffic";
    }

    @Override
    public PlaybookPlan execute(Alert alert, PlaybookOptions options) {
        List<String> urls = affectedUrls(alert);
        List<String> issues = issues(alert);
        List<RemediationStep> steps = new ArrayList<>();

        RemediationStep block = RemediationStep.of("block_applies",
                Map.of("urls", urls, "issues", issues), StepStatus.APPLIED);
        block.setReason("Landing page health check failed");
        steps.add(block);

        RemediationStep fixes = RemediationStep.of("generate_fix_list",
                Map.of("fixes", fixList(issues)), StepStatus.APPLIED);
        fixes.setOutput("lp-fixes.md");
        steps.add(fixes);

        steps.add(RemediationStep.of("pause_affected_ads",
                Map.of("urls", urls, "reason", "LP issue: " + String.join(", ", issues)),
                StepStatus.immediate(options.isDryRun())));

        steps.add(RemediationStep.of("schedule_revalidation",
                Map.of("urls", urls, "check_after", "24_hours"), StepStatus.PENDING));

        return PlaybookPlan.builder()
                .steps(steps)
                .estimatedImpact(EstimatedImpact.builder().cost(0d).clicks(0d).build())
                .build();
    }

    private static List<String> affectedUrls(Alert alert) {
        Object urls = alert.getMetrics().getAdditional().get("affected_urls");
        if (urls instanceof List<?> list && !list.isEmpty()) {
            return list.stream().map(String::valueOf).toList();
        }
        return alert.getEntity().getUrl() != null ? List.of(alert.getEntity().getUrl()) : List.of();
    }

    private static List<String> issues(Alert alert) {
        Object raw = alert.getMetrics().getAdditional().get("issues");
        Set<String> issues = new LinkedHashSet<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> issue && issue.get("issue") != null) {
                    issues.add(String.valueOf(issue.get("issue")));
                }
            }
        }
        return issues.isEmpty() ? List.of("unknown") : List.copyOf(issues);
    }

    private static List<String> fixList(List<String> issues) {
        List<String> fixes = new ArrayList<>();
        for (String issue : issues) {
            if (issue.startsWith("HTTP")) {
                fixes.add("Fix " + issue + " error");
                fixes.add("Restore page or redirect to a working page");
            } else if (issue.equals("noindex")) {
                fixes.add("Remove noindex meta tag");
                fixes.add("Check robots.txt");
            } else if (issue.equals("soft 404")) {
                fixes.add("Add substantial content");
                fixes.add("Fix thin content issues");
            }
        }
        if (fixes.isEmpty()) {
            fixes.add("Investigate landing page health");
        }
        return fixes;
    }
}
