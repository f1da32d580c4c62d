package com.billing.leakdetector.service;

import com.billing.leakdetector.model.AggregationSnapshot;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.ReviewStatus;
import com.billing.leakdetector.model.Upload;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Dashboard totals as a pure function of uploads, jobs and anomalies.
 */
public final class SnapshotCalculator {

    private SnapshotCalculator() {
    }

    public static AggregationSnapshot compute(Collection<Upload> uploads,
                                              Collection<Job> jobs,
                                              Collection<Anomaly> anomalies) {
        Set<String> uploadsWithJobs = new HashSet<>();
        Set<String> finishedUploads = new HashSet<>();
        long lastUpdated = 0;
        for (Job job : jobs) {
            uploadsWithJobs.add(job.getUploadId());
            if (job.getStatus().isTerminal()) {
                finishedUploads.add(job.getUploadId());
            }
            lastUpdated = Math.max(lastUpdated, job.getUpdatedAt());
        }

        long totalRows = 0;
        for (Upload upload : uploads) {
            if (finishedUploads.contains(upload.getId())) {
                totalRows += upload.getRowsCount();
            }
        }

        long high = 0;
        long medium = 0;
        long low = 0;
        long unreviewed = 0;
        double scoreSum = 0.0;
        for (Anomaly anomaly : anomalies) {
            scoreSum += anomaly.getAnomalyScore();
            switch (anomaly.getSeverity()) {
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
            if (anomaly.getStatus() == ReviewStatus.UNREVIEWED) {
                unreviewed++;
            }
        }

        return AggregationSnapshot.builder()
                .totalUploads(uploadsWithJobs.size())
                .totalRows(totalRows)
                .totalAnomalies(anomalies.size())
                .averageScore(anomalies.isEmpty() ? 0.0 : scoreSum / anomalies.size())
                .highSeverityCount(high)
                .mediumSeverityCount(medium)
                .lowSeverityCount(low)
                .unreviewedCount(unreviewed)
                .lastUpdated(lastUpdated)
                .build();
    }
}
