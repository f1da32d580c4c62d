package com.billing.leakdetector.repository;

import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.AnomalyFilter;
import com.billing.leakdetector.model.PagedResponse;
import com.billing.leakdetector.model.ReviewStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store of scored rows and their cached explanations.
 */
public interface AnomalyRepository {

    /**
     * Inserts a newly scored row.
     *
     * @throws com.billing.leakdetector.exception.DuplicateRowException if the row of that upload is already stored
     */
    void put(Anomaly anomaly);

    /**
     * Sets the explanation only if none is stored yet. Concurrent callers for the same anomaly
     * are serialized: exactly one of them writes, the others see {@code false}.
     *
     * @return true if this call stored the explanation, false if one was already present
     * @throws com.billing.leakdetector.exception.NotFoundException for an unknown anomaly
     */
    boolean attachExplanation(String anomalyId, Map<String, Double> explanation);

    /**
     * Anomalies of an upload ordered by score descending, then row index ascending.
     *
     * @throws com.billing.leakdetector.exception.NotFoundException if the upload is unknown
     */
    PagedResponse<Anomaly> listByUpload(String uploadId, AnomalyFilter filter, int offset, int limit);

    /**
     * Moves the review status forward.
     *
     * @return true if the status changed, false if it already was {@code target}
     * @throws com.billing.leakdetector.exception.InvalidTransitionException when {@code target} lies behind the current status
     * @throws com.billing.leakdetector.exception.NotFoundException for an unknown anomaly
     */
    boolean markReviewState(String anomalyId, ReviewStatus target);

    Optional<Anomaly> findById(String anomalyId);

    /** Row indexes already stored for the upload, used to resume a re-submitted job. */
    Set<Integer> findRowIndexes(String uploadId);

    long countByUpload(String uploadId);

    List<Anomaly> findAll();

    int deleteByUpload(String uploadId);
}
