package com.billing.leakdetector.model;

/**
 * Coarse severity tier derived from an anomaly score.
 * The thresholds live in {@link com.billing.leakdetector.config.DetectionConfig}.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
