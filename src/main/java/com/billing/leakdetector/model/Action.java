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
@Schema(description = "Append-only disposition recorded against an anomaly")
public class Action {
    private String id;
    private String anomalyId;
    private String uploadId;            // kept for cascading delete
    private ActionType actionType;
    private String notes;
    private String createdBy;           // optional operator ID
    private long createdAt;
}
