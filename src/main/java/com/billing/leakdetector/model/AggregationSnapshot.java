package com.billing.leakdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dashboard totals, derived from current jobs and anomalies on every read")
public class AggregationSnapshot {

    @Schema(description = "Distinct uploads that have at least one job", example = "4")
    private long totalUploads;

    @Schema(description = "Rows of uploads with at least one finished job", example = "6000")
    private long totalRows;

    @Schema(description = "Stored anomaly rows", example = "5870")
    private long totalAnomalies;

    @Schema(description = "Mean anomaly score over all stored rows", example = "0.231")
    private double averageScore;

    private long highSeverityCount;
    private long mediumSeverityCount;
    private long lowSeverityCount;
    private long unreviewedCount;

    @Schema(description = "Most recent job update in epoch milliseconds, 0 when there are no jobs")
    private long lastUpdated;
}
