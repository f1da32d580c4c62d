package com.billing.leakdetector.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(description = "Dataset to register. Each row maps column names to cell values")
public record RegisterUploadRequest(
        @Schema(example = "billing_2024_q1.csv") String filename,
        List<Map<String, Object>> rows) {
}
