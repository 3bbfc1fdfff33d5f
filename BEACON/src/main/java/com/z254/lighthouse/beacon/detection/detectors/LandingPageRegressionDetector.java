package com.z254.lighthouse.beacon.detection.detectors;

import com.z254.lighthouse.beacon.config.AlertConfig;
import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.DetectionSupport;
import com.z254.lighthouse.beacon.detection.Detector;
import com.z254.lighthouse.beacon.detection.DetectorResult;
import com.z254.lighthouse.beacon.detection.source.LandingPageHealthSource;
import com.z254.lighthouse.beacon.detection.source.PageHealth;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.BaselineData;
import com.z254.lighthouse.beacon.domain.model.CurrentData;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.model.SuggestedAction;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags landing pages that can no longer take paid traffic: error statuses, noindex, soft 404s.
 * Long redirect chains are reported alongside but never trigger on their own. Always critical.
 */
@Component
public class LandingPageRegressionDetector implements Detector {

    private final DetectionSupport support;
    private final LandingPageHealthSource healthSource;
    private final AlertConfig config;

    public LandingPageRegressionDetector(DetectionSupport support, LandingPageHealthSource healthSource,
                                         BeaconProperties properties) {
        this.support = support;
        this.healthSource = healthSource;
        this.config = properties.getDetection().configFor(AlertType.LP_REGRESSION);
    }

    @Override
    public AlertType getType() {
        return AlertType.LP_REGRESSION;
    }

    @Override
    public AlertConfig getConfig() {
        return config;
    }

    @Override
    public DetectorResult detect(Entity entity, TimeWindow window) {
        return support.guarded(config, entity, () -> evaluate(entity, support.resolveWindow(config, window)));
    }

    private DetectorResult evaluate(Entity entity, TimeWindow window) {
        List<PageHealth> pages = healthSource.fetchPageHealth(entity);
        if (pages.isEmpty()) {
            return DetectorResult.notTriggered("No landing page health data available");
        }

        List<Map<String, Object>> issues = new ArrayList<>();
        List<String> affectedUrls = new ArrayList<>();
        List<String> redirectWarnings = new ArrayList<>();
        for (PageHealth page : pages) {
            List<String> blocking = page.blockingIssues();
            if (!blocking.isEmpty()) {
                affectedUrls.add(page.getUrl());
                for (String issue : blocking) {
                    issues.add(Map.of("url", page.getUrl(), "issue", issue));
                }
            }
            if (page.hasLongRedirectChain()) {
                redirectWarnings.add(page.getUrl());
            }
        }
        if (affectedUrls.isEmpty()) {
            return DetectorResult.notTriggered("All landing pages healthy");
        }

        BaselineData baseline = BaselineData.builder()
                .count(pages.size())
                .period(support.baselinePeriod(window))
                .build();
        CurrentData current = CurrentData.builder()
                .value(issues.size())
                .count(pages.size())
                .period(support.currentPeriod(window))
                .build();

        Map<String, Object> additional = new LinkedHashMap<>();
        additional.put("issues", issues);
        additional.put("affected_urls", affectedUrls);
        additional.put("redirect_chains", redirectWarnings);

        Alert alert = support.buildAlert(config, entity, window, baseline, current, Severity.CRITICAL,
                String.format("%d critical landing page issues across %d URLs", issues.size(), affectedUrls.size()),
                additional);
        alert.setSuggestedActions(suggestedActions(issues, affectedUrls, redirectWarnings));

        return support.surface(config, alert);
    }

    private static List<SuggestedAction> suggestedActions(List<Map<String, Object>> issues, List<String> affectedUrls,
                                                          List<String> redirectWarnings) {
        List<SuggestedAction> actions = new ArrayList<>();
        actions.add(SuggestedAction.of("block_applies", Map.of("urls", affectedUrls)));
        boolean serverErrors = issues.stream().anyMatch(i -> String.valueOf(i.get("issue")).startsWith("HTTP"));
        boolean noindex = issues.stream().anyMatch(i -> "noindex".equals(i.get("issue")));
        if (serverErrors) {
            actions.add(SuggestedAction.of("fix_server_errors", Map.of("priority", "immediate")));
        }
        if (noindex) {
            actions.add(SuggestedAction.of("remove_noindex", Map.of("priority", "immediate")));
        }
        if (!redirectWarnings.isEmpty()) {
            actions.add(SuggestedAction.of("optimize_redirects", Map.of("urls", redirectWarnings)));
        }
        return actions;
    }
}
