package com.z254.lighthouse.beacon.api.v1;

import com.z254.lighthouse.beacon.api.dto.AlertListResponse;
import com.z254.lighthouse.beacon.api.dto.AlertView;
import com.z254.lighthouse.beacon.config.BeaconProperties;
import com.z254.lighthouse.beacon.detection.AlertEngine;
import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.domain.model.AlertBatch;
import com.z254.lighthouse.beacon.domain.model.AlertHistoryEntry;
import com.z254.lighthouse.beacon.domain.model.AlertState;
import com.z254.lighthouse.beacon.domain.model.AlertStatus;
import com.z254.lighthouse.beacon.domain.model.Entity;
import com.z254.lighthouse.beacon.domain.model.TimeWindow;
import com.z254.lighthouse.beacon.domain.service.AlertNotFoundException;
import com.z254.lighthouse.beacon.domain.service.AlertStateService;
import com.z254.lighthouse.beacon.remediation.PlaybookOptions;
import com.z254.lighthouse.beacon.remediation.Remediation;
import com.z254.lighthouse.beacon.remediation.RemediationOrchestrator;
import com.z254.lighthouse.beacon.remediation.RemediationReportRenderer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * REST API controller for alert lifecycle, scans and remediation.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert scanning, lifecycle and remediation")
public class AlertController {

    private final AlertStateService alertStateService;
    private final AlertEngine alertEngine;
    private final RemediationOrchestrator orchestrator;
    private final RemediationReportRenderer reportRenderer;
    private final BeaconProperties beaconProperties;

    public AlertController(AlertStateService alertStateService,
                           AlertEngine alertEngine,
                           RemediationOrchestrator orchestrator,
                           RemediationReportRenderer reportRenderer,
                           BeaconProperties beaconProperties) {
        this.alertStateService = alertStateService;
        this.alertEngine = alertEngine;
        this.orchestrator = orchestrator;
        this.reportRenderer = reportRenderer;
        this.beaconProperties = beaconProperties;
    }

    @GetMapping
    @Operation(summary = "List alerts", description = "List alert states, most recently seen first")
    public Mono<ResponseEntity<AlertListResponse>> listAlerts(
            @Parameter(description = "Filter by status (open, ack, snoozed, closed)")
            @RequestParam(required = false) String status,
            @Parameter(description = "Page number")
            @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size")
            @RequestParam(defaultValue = "50") int size) {

        return Mono.fromCallable(() -> {
            AlertStatus filter = status != null ? AlertStatus.fromCode(status) : null;
            List<AlertState> states = alertStateService.listStates(filter);
            return ResponseEntity.ok(AlertListResponse.builder()
                    .alerts(states.stream().skip((long) page * size).limit(size).toList())
                    .total(states.size())
                    .page(page)
                    .size(size)
                    .build());
        });
    }

    @GetMapping("/active")
    @Operation(summary = "List active alerts",
               description = "Latest payload of every alert that is neither closed nor snoozed")
    public Mono<ResponseEntity<List<Alert>>> listActiveAlerts(
            @Parameter(description = "Filter by product")
            @RequestParam(required = false) String product) {

        return Mono.fromCallable(() -> ResponseEntity.ok(alertStateService.listActiveAlerts(product)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get alert", description = "Get alert state and latest surfaced payload")
    public Mono<ResponseEntity<AlertView>> getAlert(
            @Parameter(description = "Alert ID") @PathVariable String id) {

        return Mono.justOrEmpty(alertStateService.getState(id))
                .map(state -> ResponseEntity.ok(AlertView.builder()
                        .state(state)
                        .latest(alertStateService.getLatestAlert(id).orElse(null))
                        .occurrences(alertStateService.getHistory(id).size())
                        .build()))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/history")
    @Operation(summary = "Get alert history", description = "Surfaced payloads for an alert, oldest first")
    public Mono<ResponseEntity<List<AlertHistoryEntry>>> getHistory(
            @Parameter(description = "Alert ID") @PathVariable String id) {

        return Mono.justOrEmpty(alertStateService.getState(id))
                .map(state -> ResponseEntity.ok(alertStateService.getHistory(id)))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/ack")
    @Operation(summary = "Acknowledge alert", description = "Mark an alert as acknowledged")
    public Mono<ResponseEntity<AlertState>> acknowledge(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @RequestBody(required = false) AckRequest request) {

        AckRequest body = request != null ? request : new AckRequest();
        return Mono.fromCallable(() ->
                ResponseEntity.ok(alertStateService.acknowledge(id, body.getOwner(), body.getNotes())));
    }

    @PostMapping("/{id}/unack")
    @Operation(summary = "Unacknowledge alert", description = "Return an acknowledged alert to open")
    public Mono<ResponseEntity<AlertState>> unacknowledge(
            @Parameter(description = "Alert ID") @PathVariable String id) {

        return Mono.fromCallable(() -> ResponseEntity.ok(alertStateService.unacknowledge(id)));
    }

    @PostMapping("/{id}/snooze")
    @Operation(summary = "Snooze alert", description = "Suppress an alert until the given instant")
    public Mono<ResponseEntity<AlertState>> snooze(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @Valid @RequestBody SnoozeRequest request) {

        return Mono.fromCallable(() ->
                ResponseEntity.ok(alertStateService.snooze(id, request.getUntil(), request.getNotes())));
    }

    @PostMapping("/{id}/close")
    @Operation(summary = "Close alert", description = "Close an alert")
    public Mono<ResponseEntity<AlertState>> close(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @RequestBody(required = false) CloseRequest request) {

        String notes = request != null ? request.getNotes() : null;
        return Mono.fromCallable(() -> ResponseEntity.ok(alertStateService.close(id, notes)));
    }

    @PostMapping("/{id}/remediate")
    @Operation(summary = "Remediate alert",
               description = "Run the alert's playbook through the guardrails (dry run unless disabled)")
    public Mono<ResponseEntity<Remediation>> remediate(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @RequestBody(required = false) RemediateRequest request) {

        PlaybookOptions options = toOptions(request);
        log.info("Remediation requested: alertId={}, dryRun={}, allowBidChanges={}",
                id, options.isDryRun(), options.isAllowBidChanges());

        return latestAlert(id)
                .flatMap(alert -> orchestrator.remediate(alert, options))
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/{id}/remediation-report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Render remediation report",
               description = "Run a remediation and render the outcome as plain text")
    public Mono<ResponseEntity<String>> remediationReport(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @RequestBody(required = false) RemediateRequest request) {

        PlaybookOptions options = toOptions(request);
        return latestAlert(id)
                .flatMap(alert -> orchestrator.remediate(alert, options))
                .map(reportRenderer::render)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/scan")
    @Operation(summary = "Scan product", description = "Run every enabled detector over the given entities")
    public Mono<ResponseEntity<AlertBatch>> scan(@Valid @RequestBody ScanRequest request) {
        log.info("Scan requested: product={}, entities={}", request.getProduct(), request.getEntities().size());

        return Mono.fromCallable(() -> alertEngine.checkProduct(
                        request.getProduct(), request.getEntities(), toWindow(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private Mono<Alert> latestAlert(String id) {
        return Mono.fromCallable(() -> alertStateService.getLatestAlert(id)
                .orElseThrow(() -> new AlertNotFoundException(id)));
    }

    private TimeWindow toWindow(ScanRequest request) {
        if (request.getBaselineDays() == null && request.getCurrentDays() == null) {
            return null;
        }
        TimeWindow defaults = beaconProperties.getDetection().getDefaultWindow().toTimeWindow();
        return TimeWindow.of(
                request.getBaselineDays() != null ? request.getBaselineDays() : defaults.getBaselineDays(),
                request.getCurrentDays() != null ? request.getCurrentDays() : defaults.getCurrentDays());
    }

    private PlaybookOptions toOptions(RemediateRequest request) {
        BeaconProperties.Remediation defaults = beaconProperties.getRemediation();
        boolean dryRun = request != null && request.getDryRun() != null
                ? request.getDryRun() : defaults.isDryRunDefault();
        boolean allowBidChanges = request != null && request.getAllowBidChanges() != null
                ? request.getAllowBidChanges() : defaults.isAllowBidChangesDefault();
        return PlaybookOptions.builder()
                .dryRun(dryRun)
                .allowBidChanges(allowBidChanges)
                .build();
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class AckRequest {
        private String owner;
        private String notes;
    }

    @lombok.Data
    public static class SnoozeRequest {
        @NotNull
        private Instant until;
        private String notes;
    }

    @lombok.Data
    public static class CloseRequest {
        private String notes;
    }

    @lombok.Data
    public static class RemediateRequest {
        private Boolean dryRun;
        private Boolean allowBidChanges;
    }

    @lombok.Data
    public static class ScanRequest {
        @NotBlank
        private String product;
        @NotNull
        private List<Entity> entities = new ArrayList<>();
        @Min(1)
        private Integer baselineDays;
        @Min(1)
        private Integer currentDays;
    }
}
