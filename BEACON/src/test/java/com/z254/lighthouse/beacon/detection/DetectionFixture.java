package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.stats.BaselineEvaluator;
import com.z254.lighthouse.beacon.detection.stats.CurrentPeriodEvaluator;
import com.z254.lighthouse.beacon.detection.stats.SeverityClassifier;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.EntityType;
import com.z254.lighthouse.beacon.domain.repository.InMemoryAlertStore;
import com.z254.lighthouse.beacon.observability.BeaconMetrics;
import com.z254.lighthouse.beacon.observability.BeaconStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Real detection pipeline on a fixed clock, shared by detector and engine tests.
 * <p>
 * Today is 2024-03-20, so the default 14/3 window compares 2024-03-04..17 with 2024-03-18..20.
 */
public class DetectionFixture {

    public static final Instant NOW = Instant.parse("2024-03-20T12:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2024, 3, 20);
    public static final LocalDate CURRENT_START = TODAY.minusDays(2);
    public static final LocalDate BASELINE_START = CURRENT_START.minusDays(14);
    public static final LocalDate BASELINE_END = CURRENT_START.minusDays(1);

    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final BeaconMetrics metrics = new BeaconMetrics(meterRegistry);
    public final BeaconStructuredLogger logger = new BeaconStructuredLogger();
    public final InMemoryAlertStore alertStore = new InMemoryAlertStore();
    public final BeaconProperties properties = new BeaconProperties();
    public final DetectionSupport support;

    public DetectionFixture() {
        this(1);
    }

    /**
     * @param consecutiveChecks global debounce applied to detectors created afterwards
     */
    public DetectionFixture(int consecutiveChecks) {
        properties.getDetection().getNoiseControl().setConsecutiveChecks(consecutiveChecks);
        NoiseController noiseController = new NoiseController(alertStore, logger);
        support = new DetectionSupport(new BaselineEvaluator(), new CurrentPeriodEvaluator(),
                new SeverityClassifier(), noiseController, alertStore, metrics, logger, clock);
    }

    public static Entity keyword(String id) {
        return Entity.builder()
                .id(id)
                .type(EntityType.KEYWORD)
                .product("acme")
                .market("us")
                .campaign("brand")
                .adGroup("shoes")
                .keyword("running shoes")
                .build();
    }

    public static Entity url(String id, String url) {
        return Entity.builder()
                .id(id)
                .type(EntityType.URL)
                .product("acme")
                .url(url)
                .build();
    }
}
