package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.domain.model.AlertType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detectors indexed by the alert type they raise.
 */
@Slf4j
@Component
public class DetectorRegistry {

    private final Map<AlertType, Detector> detectors = new EnumMap<>(AlertType.class);

    public DetectorRegistry(List<Detector> detectors) {
        detectors.forEach(this::register);
        log.info("Registered {} detectors: {}", this.detectors.size(), this.detectors.keySet());
    }

    public void register(Detector detector) {
        Detector previous = detectors.put(detector.getType(), detector);
        if (previous != null) {
            log.warn("Detector for {} replaced: {} -> {}", detector.getType(),
                    previous.getClass().getSimpleName(), detector.getClass().getSimpleName());
        }
    }

    public Optional<Detector> get(AlertType type) {
        return Optional.ofNullable(detectors.get(type));
    }

    /**
     * Enabled detectors in alert type order.
     */
    public List<Detector> enabled() {
        return detectors.values().stream()
                .filter(d -> d.getConfig().isEnabled())
                .toList();
    }

    public Collection<Detector> all() {
        return detectors.values();
    }
}
