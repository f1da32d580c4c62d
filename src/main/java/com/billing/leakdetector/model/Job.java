package com.billing.leakdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One processing run over a single upload. Instances are treated as immutable snapshots:
 * every state change produces a copy through {@code toBuilder()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Processing job for one uploaded dataset")
public class Job {

    @Schema(description = "Job ID")
    private String id;

    @Schema(description = "Upload this job processes")
    private String uploadId;

    @Schema(description = "Lifecycle status", example = "RUNNING")
    private JobStatus status;

    @Schema(description = "Progress percentage (0-100), never decreases", example = "40")
    private int progress;

    @Schema(description = "Rows in the dataset")
    private int rowsTotal;

    @Schema(description = "Rows handled so far, including skipped and previously stored rows")
    private int rowsProcessed;

    @Schema(description = "Anomaly rows stored for the upload when the job completed")
    private int anomaliesFound;

    @Schema(description = "Rows skipped because they were malformed or rejected by the model")
    private int skippedRows;

    @Schema(description = "Wall-clock processing time in seconds", example = "12.37")
    private double processingTimeSeconds;

    @Schema(description = "Error detail, present only when status is FAILED")
    private String errorMessage;

    private long createdAt;
    private long updatedAt;
    private long startedAt;      // 0 until claimed
    private long completedAt;    // 0 until terminal
}
