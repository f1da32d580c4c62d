package com.billing.leakdetector.model;

import java.util.Locale;
import java.util.Optional;

public enum ActionType {
    MARK_REVIEWED(ReviewStatus.REVIEWED),
    CREATE_WORK_ORDER(ReviewStatus.ACTIONED),
    EXPORT(null);

    private final ReviewStatus impliedStatus;

    ActionType(ReviewStatus impliedStatus) {
        this.impliedStatus = impliedStatus;
    }

    /** Review state the anomaly moves to when this action is recorded, if any. */
    public Optional<ReviewStatus> impliedStatus() {
        return Optional.ofNullable(impliedStatus);
    }

    /** Accepts {@code mark_reviewed}, {@code mark-reviewed} and {@code MARK_REVIEWED}. */
    public static ActionType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("actionType is required");
        }
        try {
            return ActionType.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action type: " + value
                    + ". Expected one of mark_reviewed, create_work_order, export");
        }
    }
}
