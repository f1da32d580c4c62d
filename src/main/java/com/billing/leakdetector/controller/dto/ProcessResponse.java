package com.billing.leakdetector.controller.dto;

import com.billing.leakdetector.model.JobStatus;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Acknowledgement of an accepted processing request")
public record ProcessResponse(String jobId, String uploadId, JobStatus status, String message) {
}
