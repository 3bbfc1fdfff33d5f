package com.z254.lighthouse.beacon.detection.source;

/**
 * Daily performance series a {@link MetricSource} can serve.
 */
public enum Metric {
    SPEND,
    CPC,
    CTR,
    CONVERSION_RATE,
    CLICKS,
    IMPRESSIONS
}
