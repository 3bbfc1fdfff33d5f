package com.z254.lighthouse.beacon.detection.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of the most recent crawl of a landing page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageHealth {

    private String url;

    private int statusCode;

    private boolean noindex;

    private boolean soft404;

    /** Number of redirect hops before the final response */
    private int redirectChain;

    private Instant checkedAt;

    /**
     * Problems that make the page unfit to receive paid traffic.
     */
    public List<String> blockingIssues() {
        List<String> issues = new ArrayList<>();
        if (statusCode != 200) {
            issues.add("HTTP " + statusCode);
        }
        if (noindex) {
            issues.add("noindex");
        }
        if (soft404) {
            issues.add("soft 404");
        }
        return issues;
    }

    public boolean hasLongRedirectChain() {
        return redirectChain > 1;
    }
}
