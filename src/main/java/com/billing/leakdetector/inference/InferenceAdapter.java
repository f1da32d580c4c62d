package com.billing.leakdetector.inference;

import com.billing.leakdetector.model.ScoreResult;

import java.util.Map;

/**
 * Black-box anomaly model. Implementations may be slow and need not be thread-safe;
 * callers go through {@link InferenceGateway}, which bounds concurrency and applies the timeout.
 *
 * <p>Both operations throw {@link com.billing.leakdetector.exception.InvalidRowException} when
 * the row cannot be scored, and {@link com.billing.leakdetector.exception.AdapterUnavailableException}
 * when the model itself cannot serve requests.
 */
public interface InferenceAdapter {

    /** Anomaly score in [0, 1] plus the model's label for one row. */
    ScoreResult score(Map<String, Object> row);

    /** Signed contribution of each feature to the row's score. */
    Map<String, Double> explain(Map<String, Object> row);

    String name();
}
