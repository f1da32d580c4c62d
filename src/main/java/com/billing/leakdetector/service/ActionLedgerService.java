package com.billing.leakdetector.service;

import com.billing.leakdetector.config.MetricsConfig;
import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Action;
import com.billing.leakdetector.model.ActionType;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.ReviewStatus;
import com.billing.leakdetector.repository.ActionRepository;
import com.billing.leakdetector.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class ActionLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ActionLedgerService.class);

    private final ActionRepository actionRepository;
    private final AnomalyRepository anomalyRepository;
    private final MetricsConfig metricsConfig;

    public ActionLedgerService(ActionRepository actionRepository,
                               AnomalyRepository anomalyRepository,
                               MetricsConfig metricsConfig) {
        this.actionRepository = actionRepository;
        this.anomalyRepository = anomalyRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Appends an action and advances the anomaly's review status when the action implies a
     * later one. Recording an action against an anomaly that is already at or past the implied
     * status only appends.
     *
     * @throws NotFoundException if the anomaly does not exist
     */
    public Action record(String anomalyId, ActionType actionType, String notes, String createdBy) {
        Anomaly anomaly = anomalyRepository.findById(anomalyId)
                .orElseThrow(() -> new NotFoundException("Anomaly", anomalyId));

        Action action = Action.builder()
                .id(UUID.randomUUID().toString())
                .anomalyId(anomalyId)
                .uploadId(anomaly.getUploadId())
                .actionType(actionType)
                .notes(notes)
                .createdBy(createdBy)
                .createdAt(System.currentTimeMillis())
                .build();
        actionRepository.append(action);
        metricsConfig.recordAction(actionType.name());

        Optional<ReviewStatus> implied = actionType.impliedStatus();
        if (implied.isPresent() && anomaly.getStatus().isBefore(implied.get())) {
            try {
                if (anomalyRepository.markReviewState(anomalyId, implied.get())) {
                    log.info("Anomaly {} moved {} -> {} by {}", anomalyId, anomaly.getStatus(), implied.get(), actionType);
                }
            } catch (InvalidTransitionException e) {
                // a concurrent action already moved it further
                log.debug("Anomaly {} already past {}: {}", anomalyId, implied.get(), e.getMessage());
            }
        }
        return action;
    }

    /** Actions of an anomaly, oldest first. */
    public List<Action> listByAnomaly(String anomalyId) {
        if (anomalyRepository.findById(anomalyId).isEmpty()) {
            throw new NotFoundException("Anomaly", anomalyId);
        }
        return actionRepository.findByAnomalyId(anomalyId);
    }
}
