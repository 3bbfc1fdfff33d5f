package com.z254.lighthouse.beacon.api.v1;

import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.AlertEngine;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertBatch;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import com.z254.lighthouse.beacon.domain.model.AlertStatus;
import com.z254.lighthouse.beacon.domain.model.AlertType;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import com.z254.lighthouse.beacon.domain.service.AlertNotFoundException;
import com.z254.lighthouse.beacon.domain.service.AlertStateService;
import com.z254.lighthouse.beacon.domain.service.AlertStateTransitionException;
import com.z254.lighthouse.beacon.remediation.PlaybookOptions;
import com.z254.lighthouse.beacon.remediation.Remediation;
import com.z254.lighthouse.beacon.remediation.RemediationOrchestrator;
import com.z254.lighthouse.beacon.remediation.RemediationReportRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for {@link AlertController}.
 */
@ExtendWith(MockitoExtension.class)
class AlertControllerTest {

    @Mock
    private AlertStateService alertStateService;

    @Mock
    private AlertEngine alertEngine;

    @Mock
    private RemediationOrchestrator orchestrator;

    private WebTestClient webTestClient;

    private final Alert alert = Alert.builder().id("a-1").type(AlertType.CPC_JUMP).build();

    @BeforeEach
    void setUp() {
        AlertController controller = new AlertController(alertStateService, alertEngine, orchestrator,
                new RemediationReportRenderer(), new BeaconProperties());
        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should return 404 for an unknown alert")
        void unknownAlert() {
            when(alertStateService.getState("missing")).thenReturn(Optional.empty());

            webTestClient.get().uri("/api/v1/alerts/missing")
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should acknowledge with owner from the body")
        void acknowledge() {
            when(alertStateService.acknowledge("a-1", "sam", "looking"))
                    .thenReturn(AlertState.builder().alertId("a-1").status(AlertStatus.ACK).owner("sam").build());

            webTestClient.post().uri("/api/v1/alerts/a-1/ack")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("owner", "sam", "notes", "looking"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("ack")
                    .jsonPath("$.owner").isEqualTo("sam");
        }

        @Test
        @DisplayName("should map a disallowed transition to 409")
        void conflict() {
            when(alertStateService.snooze(eq("a-1"), any(Instant.class), isNull()))
                    .thenThrow(new AlertStateTransitionException("a-1", AlertStatus.CLOSED, "snooze"));

            webTestClient.post().uri("/api/v1/alerts/a-1/snooze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("until", "2030-01-01T00:00:00Z"))
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Cannot snooze alert a-1 while closed");
        }

        @Test
        @DisplayName("should map a missing alert on close to 404")
        void closeUnknown() {
            when(alertStateService.close("nope", null)).thenThrow(new AlertNotFoundException("nope"));

            webTestClient.post().uri("/api/v1/alerts/nope/close")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Alert not found: nope");
        }

        @Test
        @DisplayName("should reject an unknown status filter")
        void badStatusFilter() {
            webTestClient.get().uri("/api/v1/alerts?status=bogus")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Unknown alert status: bogus");
        }
    }

    @Nested
    @DisplayName("Remediation")
    class RemediationTests {

        @Test
        @DisplayName("should default to a dry run without bid changes")
        void remediateDefaults() {
            when(alertStateService.getLatestAlert("a-1")).thenReturn(Optional.of(alert));
            when(orchestrator.remediate(eq(alert), any(PlaybookOptions.class)))
                    .thenReturn(Mono.just(Remediation.builder().alertId("a-1").playbook("pb_cpc_jump")
                            .guardrailsPassed(true).dryRun(true).build()));

            webTestClient.post().uri("/api/v1/alerts/a-1/remediate")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.playbook").isEqualTo("pb_cpc_jump");

            ArgumentCaptor<PlaybookOptions> options = ArgumentCaptor.forClass(PlaybookOptions.class);
            verify(orchestrator).remediate(eq(alert), options.capture());
            assertThat(options.getValue().isDryRun()).isTrue();
            assertThat(options.getValue().isAllowBidChanges()).isFalse();
        }

        @Test
        @DisplayName("should return 404 when the alert never surfaced")
        void remediateUnknown() {
            when(alertStateService.getLatestAlert("a-2")).thenReturn(Optional.empty());

            webTestClient.post().uri("/api/v1/alerts/a-2/remediate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("dryRun", false))
                    .exchange()
                    .expectStatus().isNotFound();

            verify(orchestrator, never()).remediate(any(), any());
        }

        @Test
        @DisplayName("should render the report as plain text")
        void report() {
            when(alertStateService.getLatestAlert("a-1")).thenReturn(Optional.of(alert));
            when(orchestrator.remediate(eq(alert), any(PlaybookOptions.class)))
                    .thenReturn(Mono.just(Remediation.builder().alertId("a-1").playbook("pb_cpc_jump")
                            .guardrailsPassed(true).dryRun(true).build()));

            webTestClient.post().uri("/api/v1/alerts/a-1/remediation-report")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(String.class)
                    .value(body -> assertThat(body).contains("Playbook: pb_cpc_jump").contains("Mode: dry run"));
        }
    }

    @Nested
    @DisplayName("Scan")
    class ScanTests {

        @Test
        @DisplayName("should fill a partial window from the default window")
        void scanWithPartialWindow() {
            when(alertEngine.checkProduct(eq("acme"), anyList(), any(TimeWindow.class)))
                    .thenReturn(AlertBatch.builder().product("acme").build());

            webTestClient.post().uri("/api/v1/alerts/scan")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("product", "acme", "entities", List.of(), "baselineDays", 7))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.product").isEqualTo("acme");

            verify(alertEngine).checkProduct(eq("acme"), anyList(), eq(TimeWindow.of(7, 3)));
        }

        @Test
        @DisplayName("should reject a scan without product")
        void scanValidation() {
            webTestClient.post().uri("/api/v1/alerts/scan")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("entities", List.of()))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").value(message -> assertThat((String) message).contains("product"));

            verify(alertEngine, never()).checkProduct(any(), any(), any());
        }
    }
}
