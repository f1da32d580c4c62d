package com.billing.leakdetector.service;

import com.billing.leakdetector.config.MetricsConfig;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.*;
import com.billing.leakdetector.repository.memory.InMemoryActionRepository;
import com.billing.leakdetector.repository.memory.InMemoryAnomalyRepository;
import com.billing.leakdetector.repository.memory.InMemoryUploadRepository;
import com.billing.leakdetector.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ActionLedgerServiceTest {

    @Mock private MetricsConfig metricsConfig;

    private InMemoryAnomalyRepository anomalyRepository;
    private InMemoryActionRepository actionRepository;
    private ActionLedgerService service;
    private String anomalyId;

    @BeforeEach
    void setUp() {
        InMemoryUploadRepository uploadRepository = new InMemoryUploadRepository();
        uploadRepository.save(TestDataFactory.createUpload("U1", 1), TestDataFactory.createBillingRows(1));
        anomalyRepository = new InMemoryAnomalyRepository(uploadRepository);
        anomalyRepository.put(TestDataFactory.createAnomaly("U1", 0, 0.91, Severity.HIGH));
        anomalyId = Anomaly.idFor("U1", 0);
        actionRepository = new InMemoryActionRepository();
        service = new ActionLedgerService(actionRepository, anomalyRepository, metricsConfig);
    }

    @Test
    void record_markReviewedTwice_appendsBothAndReviewsOnce() {
        service.record(anomalyId, ActionType.MARK_REVIEWED, "looked at it", "ops");
        service.record(anomalyId, ActionType.MARK_REVIEWED, null, null);

        assertThat(service.listByAnomaly(anomalyId)).hasSize(2);
        assertThat(status()).isEqualTo(ReviewStatus.REVIEWED);
        verify(metricsConfig, times(2)).recordAction("MARK_REVIEWED");
    }

    @Test
    void record_reviewAfterWorkOrder_doesNotMoveStatusBack() {
        service.record(anomalyId, ActionType.CREATE_WORK_ORDER, "WO-1182", "ops");
        service.record(anomalyId, ActionType.MARK_REVIEWED, null, "ops");

        assertThat(status()).isEqualTo(ReviewStatus.ACTIONED);
        assertThat(service.listByAnomaly(anomalyId)).extracting(Action::getActionType)
                .containsExactly(ActionType.CREATE_WORK_ORDER, ActionType.MARK_REVIEWED);
    }

    @Test
    void record_export_leavesStatusAlone() {
        Action action = service.record(anomalyId, ActionType.EXPORT, "sent to finance", "ops");

        assertThat(status()).isEqualTo(ReviewStatus.UNREVIEWED);
        assertThat(action.getUploadId()).isEqualTo("U1");
        assertThat(action.getCreatedAt()).isPositive();
    }

    @Test
    void record_unknownAnomaly_throwsNotFoundAndAppendsNothing() {
        assertThatThrownBy(() -> service.record("missing", ActionType.EXPORT, null, null))
                .isInstanceOf(NotFoundException.class);
        assertThat(actionRepository.findByAnomalyId("missing")).isEmpty();
    }

    @Test
    void listByAnomaly_keepsAppendOrder() {
        service.record(anomalyId, ActionType.EXPORT, "first", "ops");
        service.record(anomalyId, ActionType.MARK_REVIEWED, "second", "ops");
        service.record(anomalyId, ActionType.EXPORT, "third", "ops");

        List<Action> actions = service.listByAnomaly(anomalyId);

        assertThat(actions).extracting(Action::getNotes).containsExactly("first", "second", "third");
    }

    @Test
    void listByAnomaly_unknownAnomaly_throwsNotFound() {
        assertThatThrownBy(() -> service.listByAnomaly("missing")).isInstanceOf(NotFoundException.class);
    }

    private ReviewStatus status() {
        return anomalyRepository.findById(anomalyId).orElseThrow().getStatus();
    }
}
