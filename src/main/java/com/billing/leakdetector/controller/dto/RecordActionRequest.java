package com.billing.leakdetector.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Disposition to record against an anomaly")
public record RecordActionRequest(
        @Schema(description = "mark_reviewed, create_work_order or export", example = "mark_reviewed") String actionType,
        @Schema(description = "Free-text note") String notes,
        @Schema(description = "Operator recording the action") String createdBy) {
}
