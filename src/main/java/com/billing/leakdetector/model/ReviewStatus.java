package com.billing.leakdetector.model;

/**
 * Review state of an anomaly. Declaration order is the only legal direction of travel:
 * UNREVIEWED -> REVIEWED -> ACTIONED.
 */
public enum ReviewStatus {
    UNREVIEWED,
    REVIEWED,
    ACTIONED;

    public boolean isBefore(ReviewStatus other) {
        return ordinal() < other.ordinal();
    }
}
