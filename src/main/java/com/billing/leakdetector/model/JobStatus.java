package com.billing.leakdetector.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a processing job. COMPLETED and FAILED are terminal.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<JobStatus> allowedTargets() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, FAILED);
            // RUNNING -> RUNNING is a progress update
            case RUNNING -> EnumSet.of(RUNNING, COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
