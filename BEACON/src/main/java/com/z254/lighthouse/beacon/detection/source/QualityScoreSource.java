package com.z254.lighthouse.beacon.detection.source;

import com.z254.lighthouse.beacon.domain.model.Entity;

import java.util.List;

/**
 * Supplies keyword quality snapshots under an entity.
 */
public interface QualityScoreSource {

    List<KeywordQuality> fetchKeywordQuality(Entity entity);
}
