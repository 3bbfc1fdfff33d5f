package com.z254.lighthouse.beacon.remediation.guardrail;

import com.z254.lighthouse.beacon.detection.source.LandingPageHealthSource;
import com.z254.lighthouse.beacon.detection.source.PageHealth;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Refuses actions that would send traffic to a broken landing page.
 */
@Component
public class LandingPageHealthGuardrail implements Guardrail {

    private final LandingPageHealthSource healthSource;

    public LandingPageHealthGuardrail(LandingPageHealthSource healthSource) {
        this.healthSource = healthSource;
    }

    @Override
    public String getName() {
        return "landing_page_health";
    }

    @Override
    public boolean isCritical() {
        return true;
    }

    @Override
    public GuardrailResult check(ProposedAction action) {
        String url = targetUrl(action);
        if (url == null) {
            return GuardrailResult.pass();
        }
        Optional<PageHealth> health = healthSource.latestHealth(url);
        if (health.isEmpty()) {
            return GuardrailResult.pass();
        }
        List<String> issues = health.get().blockingIssues();
        if (!issues.isEmpty()) {
            return GuardrailResult.block("Landing page " + url + " unhealthy: " + String.join(", ", issues),
                    "Fix the page before routing traffic to it");
        }
        if (health.get().hasLongRedirectChain()) {
            return GuardrailResult.warn("Landing page " + url + " has " + health.get().getRedirectChain()
                    + " redirects", "Point the ad at the final URL");
        }
        return GuardrailResult.pass();
    }

    private static String targetUrl(ProposedAction action) {
        Object url = action.param("final_url");
        if (url == null) {
            url = action.param("url");
        }
        return url instanceof String s && !s.isBlank() ? s : null;
    }
}
