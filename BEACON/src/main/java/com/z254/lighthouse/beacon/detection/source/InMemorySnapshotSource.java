package com.z254.lighthouse.beacon.detection.source;

import com.z254.lighthouse.beacon.domain.model.Entity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Quality score and landing page snapshots held in memory, keyed by entity id.
 */
@Component
public class InMemorySnapshotSource implements QualityScoreSource, LandingPageHealthSource {

    private final Map<String, List<KeywordQuality>> keywordQuality = new ConcurrentHashMap<>();
    private final Map<String, List<String>> pagesByEntity = new ConcurrentHashMap<>();
    private final Map<String, PageHealth> pageHealth = new ConcurrentHashMap<>();

    public void recordKeywordQuality(Entity entity, List<KeywordQuality> snapshots) {
        keywordQuality.put(entity.getId(), new CopyOnWriteArrayList<>(snapshots));
    }

    public void recordPageHealth(Entity entity, PageHealth health) {
        pageHealth.put(health.getUrl(), health);
        pagesByEntity.computeIfAbsent(entity.getId(), id -> new CopyOnWriteArrayList<>());
        List<String> urls = pagesByEntity.get(entity.getId());
        if (!urls.contains(health.getUrl())) {
            urls.add(health.getUrl());
        }
    }

    @Override
    public List<KeywordQuality> fetchKeywordQuality(Entity entity) {
        return new ArrayList<>(keywordQuality.getOrDefault(entity.getId(), List.of()));
    }

    @Override
    public List<PageHealth> fetchPageHealth(Entity entity) {
        return pagesByEntity.getOrDefault(entity.getId(), List.of()).stream()
                .map(pageHealth::get)
                .toList();
    }

    @Override
    public Optional<PageHealth> latestHealth(String url) {
        return Optional.ofNullable(pageHealth.get(url));
    }
}
