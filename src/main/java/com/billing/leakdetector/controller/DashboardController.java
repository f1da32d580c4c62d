package com.billing.leakdetector.controller;

import com.billing.leakdetector.model.AggregationSnapshot;
import com.billing.leakdetector.service.AggregationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/dashboard")
@Tag(name = "Dashboard", description = "Aggregated totals across all uploads")
public class DashboardController {

    private final AggregationService aggregationService;

    public DashboardController(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @GetMapping("/metrics")
    @Operation(summary = "Get dashboard totals",
               description = "Uploads, rows, anomalies, severity breakdown and review backlog, derived on every request")
    public ResponseEntity<AggregationSnapshot> metrics() {
        return ResponseEntity.ok(aggregationService.snapshot());
    }
}
