package com.billing.leakdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scored result for one row of an uploaded dataset")
public class Anomaly {

    @Schema(description = "Anomaly ID, derived from upload ID and row index")
    private String id;

    @Schema(description = "Job that scored the row")
    private String jobId;

    @Schema(description = "Upload the row belongs to")
    private String uploadId;

    @Schema(description = "Zero-based row index in the original dataset", example = "2")
    private int rowIndex;

    @Schema(description = "Anomaly score in [0, 1]", example = "0.91")
    private double anomalyScore;

    @Schema(description = "Severity tier derived from the score", example = "HIGH")
    private Severity severity;

    @Schema(description = "Review status, changed only through recorded actions", example = "UNREVIEWED")
    private ReviewStatus status;

    @Schema(description = "Row timestamp from the source data in epoch milliseconds, when present")
    private Long rowTimestamp;

    @Schema(description = "Original feature values of the row, in column order")
    private Map<String, Object> featureValues;

    @Schema(description = "Per-feature attribution weights, null until first requested")
    private Map<String, Double> explanation;

    @Schema(description = "Label returned by the model", example = "anomaly")
    private String modelLabel;

    private long createdAt;
    private long updatedAt;

    /**
     * Name-based identity of a row. Two writes for the same (upload, row) always target
     * the same record, which is what lets a create-only write reject duplicates.
     */
    public static String idFor(String uploadId, int rowIndex) {
        return UUID.nameUUIDFromBytes((uploadId + "#" + rowIndex).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
