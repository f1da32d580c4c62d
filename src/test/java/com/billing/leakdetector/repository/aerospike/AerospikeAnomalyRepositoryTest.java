package com.billing.leakdetector.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.billing.leakdetector.exception.DuplicateRowException;
import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.AnomalyFilter;
import com.billing.leakdetector.model.ReviewStatus;
import com.billing.leakdetector.model.Severity;
import com.billing.leakdetector.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AerospikeAnomalyRepositoryTest {

    @Mock
    private AerospikeClient client;

    private AerospikeAnomalyRepository repository;

    @BeforeEach
    void setUp() {
        repository = new AerospikeAnomalyRepository(client, "test", new WritePolicy(), new Policy());
    }

    @Test
    void put_existingKey_throwsDuplicateRow() {
        doThrow(new AerospikeException(ResultCode.KEY_EXISTS_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.put(TestDataFactory.createAnomaly("U1", 3, 0.7, Severity.MEDIUM)))
                .isInstanceOf(DuplicateRowException.class)
                .hasMessageContaining("Row 3");
    }

    @Test
    void put_otherServerError_isRethrown() {
        doThrow(new AerospikeException(ResultCode.TIMEOUT))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.put(TestDataFactory.createAnomaly("U1", 3, 0.7, Severity.MEDIUM)))
                .isInstanceOf(AerospikeException.class);
    }

    @Test
    void attachExplanation_alreadyExplained_doesNotWrite() {
        String id = Anomaly.idFor("U1", 0);
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(anomalyRecord(id, ReviewStatus.UNREVIEWED, "{\"retries\":0.4}", 2));

        assertThat(repository.attachExplanation(id, Map.of("retries", 0.9))).isFalse();
        verify(client, never()).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void attachExplanation_lostGenerationRace_returnsFalseAfterReread() {
        String id = Anomaly.idFor("U1", 0);
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(anomalyRecord(id, ReviewStatus.UNREVIEWED, null, 1))
                .thenReturn(anomalyRecord(id, ReviewStatus.UNREVIEWED, "{\"retries\":0.4}", 2));
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThat(repository.attachExplanation(id, Map.of("retries", 0.9))).isFalse();
    }

    @Test
    void attachExplanation_unexplained_writesWithGenerationCheck() {
        String id = Anomaly.idFor("U1", 0);
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(anomalyRecord(id, ReviewStatus.UNREVIEWED, null, 6));

        assertThat(repository.attachExplanation(id, Map.of("retries", 0.9))).isTrue();
        verify(client).put(argThat(policy -> policy.generation == 6), any(Key.class), any(Bin[].class));
    }

    @Test
    void attachExplanation_unknownAnomaly_throwsNotFound() {
        assertThatThrownBy(() -> repository.attachExplanation("missing", Map.of()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void markReviewState_backwards_throwsInvalidTransition() {
        String id = Anomaly.idFor("U1", 0);
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(anomalyRecord(id, ReviewStatus.ACTIONED, null, 3));

        assertThatThrownBy(() -> repository.markReviewState(id, ReviewStatus.REVIEWED))
                .isInstanceOf(InvalidTransitionException.class);
        verify(client, never()).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void markReviewState_sameStatus_isNoOp() {
        String id = Anomaly.idFor("U1", 0);
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(anomalyRecord(id, ReviewStatus.REVIEWED, null, 3));

        assertThat(repository.markReviewState(id, ReviewStatus.REVIEWED)).isFalse();
    }

    @Test
    void findById_mapsStoredBins() {
        String id = Anomaly.idFor("U1", 0);
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(anomalyRecord(id, ReviewStatus.REVIEWED, "{\"retries\":0.4}", 3));

        Anomaly anomaly = repository.findById(id).orElseThrow();

        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getStatus()).isEqualTo(ReviewStatus.REVIEWED);
        assertThat(anomaly.getFeatureValues()).containsEntry("invoice_id", "INV-0");
        assertThat(anomaly.getExplanation()).containsEntry("retries", 0.4);
        assertThat(anomaly.getRowTimestamp()).isNull();
    }

    @Test
    void listByUpload_unknownUpload_throwsNotFound() {
        when(client.exists(any(Policy.class), any(Key.class))).thenReturn(false);

        assertThatThrownBy(() -> repository.listByUpload("NOPE", AnomalyFilter.none(), 0, 10))
                .isInstanceOf(NotFoundException.class);
    }

    private static Record anomalyRecord(String id, ReviewStatus status, String explanation, int generation) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("id", id);
        bins.put("jobId", "J1");
        bins.put("uploadId", "U1");
        bins.put("rowIndex", 0L);
        bins.put("score", 0.91);
        bins.put("severity", "HIGH");
        bins.put("status", status.name());
        bins.put("features", "{\"invoice_id\":\"INV-0\",\"invoice_amount\":100.0}");
        bins.put("label", "anomaly");
        bins.put("createdAt", 1000L);
        bins.put("updatedAt", 1000L);
        if (explanation != null) {
            bins.put("explanation", explanation);
        }
        return new Record(bins, generation, 0);
    }
}
