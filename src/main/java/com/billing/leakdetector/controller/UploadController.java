package com.billing.leakdetector.controller;

import com.billing.leakdetector.controller.dto.RegisterUploadRequest;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.AnomalyFilter;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.PagedResponse;
import com.billing.leakdetector.model.ReviewStatus;
import com.billing.leakdetector.model.Severity;
import com.billing.leakdetector.model.Upload;
import com.billing.leakdetector.service.UploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/uploads")
@Tag(name = "Uploads", description = "Dataset registration and per-upload results")
public class UploadController {

    private final UploadService uploadService;

    public UploadController(UploadService uploadService) {
        this.uploadService = uploadService;
    }

    @PostMapping
    @Operation(summary = "Register a dataset",
               description = "Stores the rows of a billing dataset so it can be processed. Rows are immutable afterwards.")
    public ResponseEntity<Upload> register(@RequestBody RegisterUploadRequest request) {
        Upload upload = uploadService.register(request.filename(), request.rows());
        return ResponseEntity.status(HttpStatus.CREATED).body(upload);
    }

    @GetMapping
    @Operation(summary = "List registered datasets")
    public ResponseEntity<List<Upload>> list() {
        return ResponseEntity.ok(uploadService.list());
    }

    @GetMapping("/{uploadId}")
    @Operation(summary = "Get upload metadata")
    public ResponseEntity<Upload> get(@PathVariable String uploadId) {
        return ResponseEntity.ok(uploadService.get(uploadId));
    }

    @DeleteMapping("/{uploadId}")
    @Operation(summary = "Delete an upload",
               description = "Removes the upload with its jobs, anomalies and actions. Rejected with 409 while a job is active.")
    public ResponseEntity<Void> delete(@PathVariable String uploadId) {
        uploadService.delete(uploadId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{uploadId}/jobs")
    @Operation(summary = "List jobs of an upload", description = "Newest first")
    public ResponseEntity<List<Job>> jobs(@PathVariable String uploadId) {
        return ResponseEntity.ok(uploadService.jobsForUpload(uploadId));
    }

    @GetMapping("/{uploadId}/anomalies")
    @Operation(summary = "List scored rows of an upload",
               description = "Ordered by anomaly score descending, ties by row index. Optional severity and review status filters.")
    public ResponseEntity<PagedResponse<Anomaly>> anomalies(
            @PathVariable String uploadId,
            @Parameter(description = "HIGH, MEDIUM or LOW") @RequestParam(required = false) String severity,
            @Parameter(description = "UNREVIEWED, REVIEWED or ACTIONED") @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "50") int limit) {
        AnomalyFilter filter = new AnomalyFilter(
                severity != null && !severity.isBlank() ? Severity.valueOf(severity.trim().toUpperCase(Locale.ROOT)) : null,
                status != null && !status.isBlank() ? ReviewStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)) : null);
        return ResponseEntity.ok(uploadService.anomalies(uploadId, filter, offset, limit));
    }
}
