package com.billing.leakdetector.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.billing.leakdetector.config.AerospikeConfig;
import com.billing.leakdetector.model.Action;
import com.billing.leakdetector.model.ActionType;
import com.billing.leakdetector.repository.ActionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeActionRepository implements ActionRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeActionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public AerospikeActionRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    @Override
    public void append(Action action) {
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        Key key = new Key(namespace, AerospikeConfig.SET_ACTIONS, action.getId());
        client.put(createOnly, key,
                new Bin("id", action.getId()),
                new Bin("anomalyId", action.getAnomalyId()),
                new Bin("uploadId", action.getUploadId()),
                new Bin("actionType", action.getActionType().name()),
                new Bin("notes", action.getNotes()),
                new Bin("createdBy", action.getCreatedBy()),
                new Bin("createdAt", action.getCreatedAt()));
    }

    @Override
    public List<Action> findByAnomalyId(String anomalyId) {
        List<Action> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ACTIONS,
                (key, record) -> {
                    try {
                        if (anomalyId.equals(record.getString("anomalyId"))) {
                            Action action = mapRecord(record);
                            synchronized (results) {
                                results.add(action);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read action record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Action::getCreatedAt).thenComparing(Action::getId));
        return results;
    }

    @Override
    public int deleteByUpload(String uploadId) {
        List<Key> keys = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ACTIONS,
                (key, record) -> {
                    if (uploadId.equals(record.getString("uploadId"))) {
                        synchronized (keys) {
                            keys.add(key);
                        }
                    }
                }, "uploadId");

        int deleted = 0;
        for (Key key : keys) {
            if (client.delete(writePolicy, key)) deleted++;
        }
        return deleted;
    }

    private Action mapRecord(Record record) {
        return Action.builder()
                .id(record.getString("id"))
                .anomalyId(record.getString("anomalyId"))
                .uploadId(record.getString("uploadId"))
                .actionType(ActionType.valueOf(record.getString("actionType")))
                .notes(record.getString("notes"))
                .createdBy(record.getString("createdBy"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }
}
