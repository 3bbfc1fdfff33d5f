package com.z254.lighthouse.beacon.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for BEACON.
 * <p>
 * Log lines take the form {@code message | data={...}} and carry the alert, remediation and
 * product identifiers in the MDC for the duration of the call.
 */
@Slf4j
@Component
public class BeaconStructuredLogger {

    // MDC keys
    public static final String MDC_ALERT_ID = "alertId";
    public static final String MDC_REMEDIATION_ID = "remediationId";
    public static final String MDC_PRODUCT = "product";

    /**
     * Log a detector outcome for one entity.
     */
    public void logDetectionEvent(String alertId, String alertType, String entityId,
                                  DetectionEventType eventType, String message,
                                  Map<String, Object> details) {
        try (var scope = withContext(context(MDC_ALERT_ID, alertId))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("alertType", alertType);
            logData.put("entityId", entityId);
            if (alertId != null) {
                logData.put("alertId", alertId);
            }
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case SURFACED -> log.info("{} | data={}", message, formatLogData(logData));
                case ERROR -> log.error("{} | data={}", message, formatLogData(logData));
                case SUPPRESSED, NOT_TRIGGERED -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a lifecycle transition on a persisted alert.
     */
    public void logAlertStateEvent(String alertId, AlertStateEventType eventType, String message,
                                   Map<String, Object> details) {
        try (var scope = withContext(context(MDC_ALERT_ID, alertId))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("alertId", alertId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case REJECTED -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a remediation event.
     */
    public void logRemediationEvent(String remediationId, String alertId,
                                    RemediationEventType eventType, String message,
                                    Map<String, Object> details) {
        Map<String, String> context = context(MDC_REMEDIATION_ID, remediationId);
        context.putAll(context(MDC_ALERT_ID, alertId));
        try (var scope = withContext(context)) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("remediationId", remediationId);
            if (alertId != null) {
                logData.put("alertId", alertId);
            }
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case STARTED, COMPLETED -> log.info("{} | data={}", message, formatLogData(logData));
                case GUARDRAIL_BLOCKED, PLAYBOOK_MISSING -> log.warn("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    public MDCScope withProduct(String product) {
        if (product == null) {
            return new MDCScope();
        }
        MDC.put(MDC_PRODUCT, product);
        return new MDCScope(MDC_PRODUCT);
    }

    private static Map<String, String> context(String key, String value) {
        Map<String, String> context = new HashMap<>();
        if (value != null) {
            context.put(key, value);
        }
        return context;
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum DetectionEventType {
        SURFACED, SUPPRESSED, NOT_TRIGGERED, ERROR
    }

    public enum AlertStateEventType {
        ACKNOWLEDGED, UNACKNOWLEDGED, SNOOZED, SNOOZE_EXPIRED, CLOSED, REOPENED, REJECTED
    }

    public enum RemediationEventType {
        STARTED, PLAYBOOK_MISSING, GUARDRAIL_BLOCKED, COMPLETED, FAILED, LOGGED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
