package com.z254.lighthouse.beacon.remediation;

import com.z254.lighthouse.beacon.domain.model.Alert;
import com.z254.lighthouse.beacon.kafka.AlertEventProducer;
import com.z254.lighthouse.beacon.observability.BeaconMetrics;
import com.z254.lighthouse.beacon.observability.BeaconStructuredLogger;
import com.z254.lighthouse.beacon.remediation.guardrail.GuardrailEvaluator;
import com.z254.lighthouse.beacon.remediation.guardrail.GuardrailVerdict;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Remediation orchestrator.
 * <p>
 * Coordinates the remediation pipeline:
 * <ol>
 *     <li>Playbook lookup by the alert's playbook identifier</li>
 *     <li>Plan generation by the playbook</li>
 *     <li>Guardrail evaluation of every step</li>
 *     <li>Remediation log entry when not a dry run and every guardrail passed</li>
 * </ol>
 * The returned remediation never errors: failures become a remediation with no steps and an
 * {@code "Execution error: ..."} blocker.
 */
@Slf4j
@Service
public class RemediationOrchestrator {

    private final PlaybookRegistry playbookRegistry;
    private final GuardrailEvaluator guardrailEvaluator;
    private final RemediationLog remediationLog;
    private final AlertEventProducer eventProducer;
    private final BeaconMetrics metrics;
    private final BeaconStructuredLogger logger;
    private final Clock clock;

    public RemediationOrchestrator(PlaybookRegistry playbookRegistry,
                                   GuardrailEvaluator guardrailEvaluator,
                                   RemediationLog remediationLog,
                                   AlertEventProducer eventProducer,
                                   BeaconMetrics metrics,
                                   BeaconStructuredLogger logger,
                                   Clock clock) {
        this.playbookRegistry = playbookRegistry;
        this.guardrailEvaluator = guardrailEvaluator;
        this.remediationLog = remediationLog;
        this.eventProducer = eventProducer;
        this.metrics = metrics;
        this.logger = logger;
        this.clock = clock;
    }

    /**
     * Plan, check and (unless dry run) record a remediation for an alert.
     */
    public Mono<Remediation> remediate(Alert alert, PlaybookOptions options) {
        return Mono.defer(() -> {
            String remediationId = generateRemediationId();
            String playbookId = alert.resolvePlaybookId();
            Timer.Sample timerSample = metrics.startRemediationTimer();

            logger.logRemediationEvent(remediationId, alert.getId(),
                    BeaconStructuredLogger.RemediationEventType.STARTED,
                    "Starting remediation",
                    Map.of("playbook", playbookId, "dryRun", options.isDryRun(),
                            "allowBidChanges", options.isAllowBidChanges()));

            Optional<Playbook> playbook = playbookRegistry.getPlaybook(playbookId);
            if (playbook.isEmpty()) {
                return Mono.just(handleMissingPlaybook(remediationId, alert, playbookId, options, timerSample));
            }

            return Mono.fromCallable(() -> execute(remediationId, alert, playbook.get(), options, timerSample))
                    .onErrorResume(error -> Mono.just(
                            handleRemediationError(remediationId, alert, playbookId, options, error, timerSample)));
        });
    }

    // ========== Private Methods ==========

    private Remediation execute(String remediationId, Alert alert, Playbook playbook,
                                PlaybookOptions options, Timer.Sample timerSample) {
        PlaybookPlan plan = playbook.execute(alert, options);
        List<RemediationStep> steps = plan.getSteps() != null ? plan.getSteps() : new ArrayList<>();

        GuardrailVerdict verdict = guardrailEvaluator.evaluate(steps, plan.getEstimatedImpact(), alert.getEntity());

        Remediation remediation = Remediation.builder()
                .alertId(alert.getId())
                .playbook(playbook.getId())
                .steps(steps)
                .guardrailsPassed(verdict.passed())
                .blockers(new ArrayList<>(verdict.blockers()))
                .warnings(new ArrayList<>(verdict.warnings()))
                .estimatedImpact(plan.getEstimatedImpact() != null ? plan.getEstimatedImpact() : EstimatedImpact.none())
                .dryRun(options.isDryRun())
                .build();

        long skipped = steps.stream().filter(s -> s.getStatus() == StepStatus.SKIPPED).count();
        metrics.recordRemediationCompleted(timerSample, verdict.passed(), (int) skipped);
        verdict.blockedBy().forEach(metrics::recordGuardrailBlock);

        if (!verdict.passed()) {
            logger.logRemediationEvent(remediationId, alert.getId(),
                    BeaconStructuredLogger.RemediationEventType.GUARDRAIL_BLOCKED,
                    "Remediation steps blocked by guardrails",
                    Map.of("blockers", String.join("; ", verdict.blockers()), "skippedSteps", skipped));
        } else {
            logger.logRemediationEvent(remediationId, alert.getId(),
                    BeaconStructuredLogger.RemediationEventType.COMPLETED,
                    "Remediation plan ready",
                    Map.of("steps", steps.size(), "warnings", verdict.warnings().size()));
        }

        if (!options.isDryRun() && verdict.passed()) {
            remediation.setAppliedAt(clock.instant());
            remediationLog.append(RemediationLogEntry.from(remediationId, remediation));
            eventProducer.publishRemediation(remediation);
            logger.logRemediationEvent(remediationId, alert.getId(),
                    BeaconStructuredLogger.RemediationEventType.LOGGED,
                    "Remediation recorded",
                    Map.of("appliedAt", remediation.getAppliedAt().toString()));
        }
        return remediation;
    }

    private Remediation handleMissingPlaybook(String remediationId, Alert alert, String playbookId,
                                              PlaybookOptions options, Timer.Sample timerSample) {
        metrics.recordRemediationCompleted(timerSample, false, 0);
        String blocker = "No playbook registered for " + playbookId;

        logger.logRemediationEvent(remediationId, alert.getId(),
                BeaconStructuredLogger.RemediationEventType.PLAYBOOK_MISSING,
                blocker, Map.of("playbook", playbookId));

        return failed(alert, playbookId, options, blocker);
    }

    private Remediation handleRemediationError(String remediationId, Alert alert, String playbookId,
                                               PlaybookOptions options, Throwable error, Timer.Sample timerSample) {
        metrics.recordRemediationFailed(timerSample);

        logger.logRemediationEvent(remediationId, alert.getId(),
                BeaconStructuredLogger.RemediationEventType.FAILED,
                "Remediation error: " + error.getMessage(),
                Map.of("errorType", error.getClass().getSimpleName()));

        return failed(alert, playbookId, options, "Execution error: " + error.getMessage());
    }

    private static Remediation failed(Alert alert, String playbookId, PlaybookOptions options, String blocker) {
        return Remediation.builder()
                .alertId(alert.getId())
                .playbook(playbookId)
                .guardrailsPassed(false)
                .blockers(new ArrayList<>(List.of(blocker)))
                .dryRun(options.isDryRun())
                .build();
    }

    private static String generateRemediationId() {
        return "REM-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
