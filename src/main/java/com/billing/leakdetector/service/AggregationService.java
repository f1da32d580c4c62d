package com.billing.leakdetector.service;

import com.billing.leakdetector.model.AggregationSnapshot;
import com.billing.leakdetector.repository.AnomalyRepository;
import com.billing.leakdetector.repository.JobRepository;
import com.billing.leakdetector.repository.UploadRepository;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

/**
 * Read-time dashboard aggregation. Nothing is cached: every call reads the current jobs,
 * anomalies and uploads and derives the totals from scratch.
 */
@Service
public class AggregationService {

    private final UploadRepository uploadRepository;
    private final JobRepository jobRepository;
    private final AnomalyRepository anomalyRepository;

    public AggregationService(UploadRepository uploadRepository,
                              JobRepository jobRepository,
                              AnomalyRepository anomalyRepository) {
        this.uploadRepository = uploadRepository;
        this.jobRepository = jobRepository;
        this.anomalyRepository = anomalyRepository;
    }

    @Observed(name = "dashboard.snapshot", contextualName = "compute-dashboard-snapshot")
    public AggregationSnapshot snapshot() {
        return SnapshotCalculator.compute(
                uploadRepository.findAll(),
                jobRepository.findAll(),
                anomalyRepository.findAll());
    }
}
