package com.billing.leakdetector.engine;

import com.billing.leakdetector.config.DetectionConfig;
import com.billing.leakdetector.model.Severity;
import org.springframework.stereotype.Component;

/**
 * Maps an anomaly score to its severity tier. Both thresholds are inclusive lower bounds.
 */
@Component
public class SeverityPolicy {

    private final DetectionConfig config;

    public SeverityPolicy(DetectionConfig config) {
        this.config = config;
    }

    public Severity classify(double score) {
        DetectionConfig.SeverityThresholds thresholds = config.getSeverity();
        if (score >= thresholds.getHigh()) return Severity.HIGH;
        if (score >= thresholds.getMedium()) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
