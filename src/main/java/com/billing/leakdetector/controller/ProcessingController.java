package com.billing.leakdetector.controller;

import com.billing.leakdetector.controller.dto.ProcessResponse;
import com.billing.leakdetector.engine.ProcessingEngine;
import com.billing.leakdetector.model.Job;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/process")
@Tag(name = "Processing", description = "Asynchronous anomaly detection jobs")
public class ProcessingController {

    private final ProcessingEngine processingEngine;

    public ProcessingController(ProcessingEngine processingEngine) {
        this.processingEngine = processingEngine;
    }

    @PostMapping("/{uploadId}")
    @Operation(summary = "Start processing an upload",
               description = "Queues a job and returns immediately. 409 if the upload already has a queued or running job.")
    public ResponseEntity<ProcessResponse> start(@PathVariable String uploadId) {
        Job job = processingEngine.submit(uploadId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new ProcessResponse(job.getId(), uploadId, job.getStatus(),
                        "Processing started. Poll /api/v1/process/status/" + job.getId() + " for progress."));
    }

    @GetMapping("/status/{jobId}")
    @Operation(summary = "Get job status", description = "Current status, progress and counters of a job")
    public ResponseEntity<Job> status(@PathVariable String jobId) {
        return ResponseEntity.ok(processingEngine.getJob(jobId));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel a job",
               description = "Marks a queued or running job FAILED and stops its worker. Rows already stored are kept.")
    public ResponseEntity<Job> cancel(@PathVariable String jobId) {
        return ResponseEntity.ok(processingEngine.cancel(jobId));
    }
}
