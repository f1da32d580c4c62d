package com.billing.leakdetector.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Error body returned for every failed request")
public record ErrorResponse(
        @Schema(description = "Machine-readable error code", example = "ALREADY_PROCESSING") String code,
        @Schema(description = "Human-readable message") String message,
        @Schema(description = "Additional context, may be empty") Map<String, Object> details) {
}
