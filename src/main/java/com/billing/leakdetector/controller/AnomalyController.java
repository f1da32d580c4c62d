package com.billing.leakdetector.controller;

import com.billing.leakdetector.controller.dto.RecordActionRequest;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Action;
import com.billing.leakdetector.model.ActionType;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.Explanation;
import com.billing.leakdetector.repository.AnomalyRepository;
import com.billing.leakdetector.service.ActionLedgerService;
import com.billing.leakdetector.service.ExplanationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Scored rows, cached explanations and recorded actions")
public class AnomalyController {

    private final AnomalyRepository anomalyRepository;
    private final ExplanationService explanationService;
    private final ActionLedgerService actionLedgerService;

    public AnomalyController(AnomalyRepository anomalyRepository,
                             ExplanationService explanationService,
                             ActionLedgerService actionLedgerService) {
        this.anomalyRepository = anomalyRepository;
        this.explanationService = explanationService;
        this.actionLedgerService = actionLedgerService;
    }

    @GetMapping("/{anomalyId}")
    @Operation(summary = "Get an anomaly")
    public ResponseEntity<Anomaly> get(@PathVariable String anomalyId) {
        return ResponseEntity.ok(anomalyRepository.findById(anomalyId)
                .orElseThrow(() -> new NotFoundException("Anomaly", anomalyId)));
    }

    @GetMapping("/{anomalyId}/explanation")
    @Operation(summary = "Get the explanation of an anomaly",
               description = "Computed on the first request and cached; later requests return the cached result.")
    public ResponseEntity<Explanation> explanation(@PathVariable String anomalyId) {
        return ResponseEntity.ok(explanationService.explain(anomalyId));
    }

    @PostMapping("/{anomalyId}/actions")
    @Operation(summary = "Record an action",
               description = "mark_reviewed moves the anomaly to REVIEWED, create_work_order to ACTIONED, export leaves it unchanged.")
    public ResponseEntity<Action> recordAction(@PathVariable String anomalyId,
                                               @RequestBody RecordActionRequest request) {
        ActionType type = ActionType.parse(request.actionType());
        Action action = actionLedgerService.record(anomalyId, type, request.notes(), request.createdBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(action);
    }

    @GetMapping("/{anomalyId}/actions")
    @Operation(summary = "List actions of an anomaly", description = "Oldest first")
    public ResponseEntity<List<Action>> actions(@PathVariable String anomalyId) {
        return ResponseEntity.ok(actionLedgerService.listByAnomaly(anomalyId));
    }
}
