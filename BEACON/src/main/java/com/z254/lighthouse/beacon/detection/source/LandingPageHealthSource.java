package com.z254.lighthouse.beacon.detection.source;

import com.z254.lighthouse.beacon.domain.model.Entity;

import java.util.List;
import java.util.Optional;

/**
 * Supplies landing page crawl results.
 */
public interface LandingPageHealthSource {

    /**
     * Latest health of every page the entity sends traffic to.
     */
    List<PageHealth> fetchPageHealth(Entity entity);

    Optional<PageHealth> latestHealth(String url);
}
