package com.z254.lighthouse.beacon.detection;

import com.z254.lighthouse.beacon.config.NoiseControlConfig;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import com.z254.lighthouse.beacon.domain.model.AlertStatus;
import com.z254.lighthouse.beacon.domain.model.Severity;
import com.z254.lighthouse.beacon.domain.repository.InMemoryAlertStore;
import com.z254.lighthouse.beacon.observability.BeaconStructuredLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NoiseController}.
 */
class NoiseControllerTest {

    private static final String ALERT_ID = "a1b2c3d4e5f60718";
    private static final Instant T0 = Instant.parse("2024-03-20T08:00:00Z");

    private InMemoryAlertStore store;
    private NoiseController controller;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore();
        controller = new NoiseController(store, new BeaconStructuredLogger());
    }

    @Nested
    @DisplayName("Consecutive strategy")
    class ConsecutiveTests {

        private final NoiseControlConfig config =
                NoiseControlConfig.of(NoiseControlConfig.Strategy.CONSECUTIVE, 3, 24);

        @Test
        @DisplayName("should suppress until the configured number of detections is reached")
        void debounce() {
            NoiseDecision first = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0);
            NoiseDecision second = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plusSeconds(60));
            NoiseDecision third = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plusSeconds(120));

            assertThat(first.surfaced()).isFalse();
            assertThat(first.reason()).isEqualTo("Noise control: 1 of 3 consecutive detections");
            assertThat(second.surfaced()).isFalse();
            assertThat(third.surfaced()).isTrue();
            assertThat(third.state().getConsecutive()).isEqualTo(3);
            assertThat(third.state().getFirstSeen()).isEqualTo(T0);
            assertThat(third.state().getLastSeen()).isEqualTo(T0.plusSeconds(120));
        }

        @Test
        @DisplayName("should persist the count of suppressed detections")
        void suppressedDetectionsAreRecorded() {
            controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0);

            AlertState state = store.getState(ALERT_ID).orElseThrow();
            assertThat(state.getConsecutive()).isEqualTo(1);
            assertThat(state.getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(state.getLastSeen()).isEqualTo(T0);
        }

        @Test
        @DisplayName("should keep surfacing once past the threshold")
        void surfacesAfterThreshold() {
            NoiseControlConfig single = NoiseControlConfig.of(NoiseControlConfig.Strategy.CONSECUTIVE, 1, 24);

            assertThat(controller.evaluate(ALERT_ID, single, Severity.LOW, T0).surfaced()).isTrue();
            assertThat(controller.evaluate(ALERT_ID, single, Severity.LOW, T0.plusSeconds(5)).surfaced()).isTrue();
            assertThat(store.getState(ALERT_ID).orElseThrow().getConsecutive()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Cooldown strategy")
    class CooldownTests {

        private final NoiseControlConfig config =
                NoiseControlConfig.of(NoiseControlConfig.Strategy.COOLDOWN, 2, 24);

        @Test
        @DisplayName("should suppress inside the cooldown and surface after it")
        void cooldownWindow() {
            NoiseDecision first = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0);
            NoiseDecision inside = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plus(Duration.ofHours(1)));
            NoiseDecision after = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plus(Duration.ofHours(25)));

            assertThat(first.surfaced()).isTrue();
            assertThat(inside.surfaced()).isFalse();
            assertThat(inside.reason()).startsWith("Cooldown active until");
            assertThat(after.surfaced()).isTrue();
        }

        @Test
        @DisplayName("should leave the state untouched when suppressed by cooldown")
        void cooldownDoesNotWrite() {
            controller.evaluate(ALERT_ID, config, Severity.HIGH, T0);
            AlertState before = store.getState(ALERT_ID).orElseThrow();

            controller.evaluate(ALERT_ID, config, Severity.CRITICAL, T0.plus(Duration.ofHours(2)));

            assertThat(store.getState(ALERT_ID).orElseThrow()).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("Combined strategy")
    class BothTests {

        private final NoiseControlConfig config =
                NoiseControlConfig.of(NoiseControlConfig.Strategy.BOTH, 2, 24);

        @Test
        @DisplayName("should measure cooldown from the last detection even when it was suppressed")
        void cooldownFromLastSeen() {
            NoiseDecision first = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0);
            NoiseDecision inside = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plus(Duration.ofHours(1)));

            assertThat(first.surfaced()).isFalse();
            assertThat(store.getState(ALERT_ID).orElseThrow().getLastSeen()).isEqualTo(T0);
            assertThat(inside.surfaced()).isFalse();
            assertThat(inside.reason()).isEqualTo("Cooldown active until " + T0.plus(Duration.ofHours(24)));
        }

        @Test
        @DisplayName("should surface once the cooldown after the last detection has passed")
        void surfacesAfterCooldown() {
            controller.evaluate(ALERT_ID, config, Severity.HIGH, T0);
            controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plus(Duration.ofHours(1)));

            NoiseDecision after = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plus(Duration.ofHours(25)));
            NoiseDecision again = controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plus(Duration.ofHours(26)));

            assertThat(after.surfaced()).isTrue();
            assertThat(after.state().getConsecutive()).isEqualTo(2);
            assertThat(again.surfaced()).isFalse();
        }
    }

    @Nested
    @DisplayName("Concurrent detections")
    class ConcurrencyTests {

        @Test
        @DisplayName("should count every detection of the same alert exactly once")
        void noLostIncrements() throws Exception {
            NoiseControlConfig config = NoiseControlConfig.of(NoiseControlConfig.Strategy.CONSECUTIVE, 1, 24);
            int threads = 8;
            int perThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            controller.evaluate(ALERT_ID, config, Severity.HIGH, T0.plusSeconds(i));
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            AlertState state = store.getState(ALERT_ID).orElseThrow();
            assertThat(state.getConsecutive()).isEqualTo(threads * perThread);
            assertThat(state.getFirstSeen()).isEqualTo(T0);
            assertThat(store.findAllStates()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Lifecycle interaction")
    class LifecycleTests {

        private final NoiseControlConfig config =
                NoiseControlConfig.of(NoiseControlConfig.Strategy.CONSECUTIVE, 1, 24);

        @Test
        @DisplayName("should reopen a closed alert when it surfaces again")
        void reopensClosed() {
            controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0);
            store.upsertState(ALERT_ID, s -> s.toBuilder().status(AlertStatus.CLOSED).build());

            NoiseDecision decision = controller.evaluate(ALERT_ID, config, Severity.CRITICAL, T0.plusSeconds(30));

            assertThat(decision.surfaced()).isTrue();
            assertThat(decision.state().getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(decision.state().getSeverity()).isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("should keep an acknowledged alert acknowledged")
        void keepsAcknowledged() {
            controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0);
            store.upsertState(ALERT_ID, s -> s.toBuilder().status(AlertStatus.ACK).build());

            NoiseDecision decision = controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0.plusSeconds(30));

            assertThat(decision.surfaced()).isTrue();
            assertThat(decision.state().getStatus()).isEqualTo(AlertStatus.ACK);
        }

        @Test
        @DisplayName("should suppress while snoozed but still count the occurrence")
        void suppressesWhileSnoozed() {
            controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0);
            Instant until = T0.plus(Duration.ofHours(6));
            store.upsertState(ALERT_ID, s -> s.toBuilder().status(AlertStatus.SNOOZED).snoozeUntil(until).build());

            NoiseDecision decision = controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0.plus(Duration.ofHours(1)));

            assertThat(decision.surfaced()).isFalse();
            assertThat(decision.reason()).isEqualTo("Snoozed until " + until);
            assertThat(store.getState(ALERT_ID).orElseThrow().getConsecutive()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reopen and surface once the snooze has expired")
        void expiredSnoozeReopens() {
            controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0);
            store.upsertState(ALERT_ID, s -> s.toBuilder()
                    .status(AlertStatus.SNOOZED)
                    .snoozeUntil(T0.plus(Duration.ofHours(2)))
                    .build());

            NoiseDecision decision = controller.evaluate(ALERT_ID, config, Severity.MEDIUM, T0.plus(Duration.ofHours(3)));

            assertThat(decision.surfaced()).isTrue();
            assertThat(decision.state().getStatus()).isEqualTo(AlertStatus.OPEN);
            assertThat(decision.state().getSnoozeUntil()).isNull();
        }
    }
}
