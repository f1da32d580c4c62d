package com.billing.leakdetector.repository;

import com.billing.leakdetector.model.Action;

import java.util.List;

/**
 * Append-only log of dispositions. There is no update operation.
 */
public interface ActionRepository {

    void append(Action action);

    /** Actions of one anomaly, oldest first. */
    List<Action> findByAnomalyId(String anomalyId);

    int deleteByUpload(String uploadId);
}
