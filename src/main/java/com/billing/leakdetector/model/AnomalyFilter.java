package com.billing.leakdetector.model;

/**
 * Optional filters for listing anomalies of an upload. A null field matches everything.
 */
public record AnomalyFilter(Severity severity, ReviewStatus status) {

    public static AnomalyFilter none() {
        return new AnomalyFilter(null, null);
    }

    public boolean matches(Anomaly anomaly) {
        if (severity != null && anomaly.getSeverity() != severity) return false;
        return status == null || anomaly.getStatus() == status;
    }
}
