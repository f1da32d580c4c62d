package com.billing.leakdetector.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.billing.leakdetector.config.AerospikeConfig;
import com.billing.leakdetector.exception.DuplicateRowException;
import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.AnomalyFilter;
import com.billing.leakdetector.model.PagedResponse;
import com.billing.leakdetector.model.ReviewStatus;
import com.billing.leakdetector.model.Severity;
import com.billing.leakdetector.repository.AnomalyRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeAnomalyRepository implements AnomalyRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAnomalyRepository.class);

    static final int MAX_CAS_ATTEMPTS = 16;

    static final Comparator<Anomaly> BY_SCORE_DESC = Comparator
            .comparingDouble(Anomaly::getAnomalyScore).reversed()
            .thenComparingInt(Anomaly::getRowIndex);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final JsonBins json;

    public AerospikeAnomalyRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.json = new JsonBins(new ObjectMapper());
    }

    @Override
    public void put(Anomaly anomaly) {
        String expectedId = Anomaly.idFor(anomaly.getUploadId(), anomaly.getRowIndex());
        if (!expectedId.equals(anomaly.getId())) {
            throw new IllegalArgumentException("Anomaly id " + anomaly.getId()
                    + " does not match row " + anomaly.getRowIndex() + " of upload " + anomaly.getUploadId());
        }

        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("id", anomaly.getId()));
        bins.add(new Bin("jobId", anomaly.getJobId()));
        bins.add(new Bin("uploadId", anomaly.getUploadId()));
        bins.add(new Bin("rowIndex", anomaly.getRowIndex()));
        bins.add(new Bin("score", anomaly.getAnomalyScore()));
        bins.add(new Bin("severity", anomaly.getSeverity().name()));
        bins.add(new Bin("status", anomaly.getStatus().name()));
        bins.add(new Bin("features", json.write(anomaly.getFeatureValues())));
        bins.add(new Bin("createdAt", anomaly.getCreatedAt()));
        bins.add(new Bin("updatedAt", anomaly.getUpdatedAt()));
        if (anomaly.getRowTimestamp() != null) {
            bins.add(new Bin("rowTs", anomaly.getRowTimestamp().longValue()));
        }
        if (anomaly.getModelLabel() != null) {
            bins.add(new Bin("label", anomaly.getModelLabel()));
        }
        if (anomaly.getExplanation() != null) {
            bins.add(new Bin("explanation", json.write(anomaly.getExplanation())));
        }

        try {
            client.put(createOnly, key(anomaly.getId()), bins.toArray(new Bin[0]));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw new DuplicateRowException(anomaly.getUploadId(), anomaly.getRowIndex());
            }
            throw e;
        }
    }

    /**
     * Generation-checked write: the explanation is written only against the exact record version
     * that was read without one. A concurrent writer bumps the generation, which sends the loser
     * back to re-read and find the winner's explanation.
     */
    @Override
    public boolean attachExplanation(String anomalyId, Map<String, Double> explanation) {
        Key key = key(anomalyId);
        String encoded = json.write(explanation);

        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            if (record == null) {
                throw new NotFoundException("Anomaly", anomalyId);
            }
            if (record.getString("explanation") != null) {
                return false;
            }

            try {
                client.put(casPolicy(record.generation), key,
                        new Bin("explanation", encoded),
                        new Bin("updatedAt", System.currentTimeMillis()));
                return true;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) throw e;
                log.debug("Explanation write for anomaly {} lost a generation race, re-reading", anomalyId);
            }
        }
        throw new ConcurrentModificationException("Could not attach explanation to anomaly " + anomalyId
                + " after " + MAX_CAS_ATTEMPTS + " attempts");
    }

    @Override
    public PagedResponse<Anomaly> listByUpload(String uploadId, AnomalyFilter filter, int offset, int limit) {
        if (!client.exists(readPolicy, new Key(namespace, AerospikeConfig.SET_UPLOADS, uploadId))) {
            throw new NotFoundException("Upload", uploadId);
        }
        AnomalyFilter effective = filter != null ? filter : AnomalyFilter.none();

        List<Anomaly> matches = scanUpload(uploadId);
        matches.removeIf(a -> !effective.matches(a));
        matches.sort(BY_SCORE_DESC);

        int from = Math.min(Math.max(offset, 0), matches.size());
        int to = Math.min(from + Math.max(limit, 0), matches.size());
        List<Anomaly> page = new ArrayList<>(matches.subList(from, to));
        return new PagedResponse<>(page, matches.size(), from, limit, to < matches.size());
    }

    @Override
    public boolean markReviewState(String anomalyId, ReviewStatus target) {
        Key key = key(anomalyId);

        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            if (record == null) {
                throw new NotFoundException("Anomaly", anomalyId);
            }
            ReviewStatus current = ReviewStatus.valueOf(record.getString("status"));
            if (current == target) {
                return false;
            }
            if (target.isBefore(current)) {
                throw new InvalidTransitionException("anomaly " + anomalyId, current, target);
            }

            try {
                client.put(casPolicy(record.generation), key,
                        new Bin("status", target.name()),
                        new Bin("updatedAt", System.currentTimeMillis()));
                return true;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) throw e;
                log.debug("Review state write for anomaly {} lost a generation race, re-reading", anomalyId);
            }
        }
        throw new ConcurrentModificationException("Could not update review state of anomaly " + anomalyId
                + " after " + MAX_CAS_ATTEMPTS + " attempts");
    }

    @Override
    public Optional<Anomaly> findById(String anomalyId) {
        Record record = client.get(readPolicy, key(anomalyId));
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(record));
    }

    @Override
    public Set<Integer> findRowIndexes(String uploadId) {
        Set<Integer> indexes = new HashSet<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    if (uploadId.equals(record.getString("uploadId"))) {
                        synchronized (indexes) {
                            indexes.add(record.getInt("rowIndex"));
                        }
                    }
                }, "uploadId", "rowIndex");
        return indexes;
    }

    @Override
    public long countByUpload(String uploadId) {
        AtomicLong count = new AtomicLong();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    if (uploadId.equals(record.getString("uploadId"))) {
                        count.incrementAndGet();
                    }
                }, "uploadId");
        return count.get();
    }

    @Override
    public List<Anomaly> findAll() {
        List<Anomaly> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    try {
                        Anomaly anomaly = mapRecord(record);
                        synchronized (results) {
                            results.add(anomaly);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });
        return results;
    }

    @Override
    public int deleteByUpload(String uploadId) {
        List<Key> keys = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
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

    private List<Anomaly> scanUpload(String uploadId) {
        List<Anomaly> results = new ArrayList<>();
        client.scanAll(scanPolicy(), namespace, AerospikeConfig.SET_ANOMALIES,
                (key, record) -> {
                    try {
                        if (uploadId.equals(record.getString("uploadId"))) {
                            Anomaly anomaly = mapRecord(record);
                            synchronized (results) {
                                results.add(anomaly);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read anomaly record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private WritePolicy casPolicy(int generation) {
        WritePolicy cas = new WritePolicy(writePolicy);
        cas.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        cas.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        cas.generation = generation;
        return cas;
    }

    private ScanPolicy scanPolicy() {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        return scanPolicy;
    }

    private Key key(String anomalyId) {
        return new Key(namespace, AerospikeConfig.SET_ANOMALIES, anomalyId);
    }

    private Anomaly mapRecord(Record record) {
        Object rowTs = record.getValue("rowTs");
        return Anomaly.builder()
                .id(record.getString("id"))
                .jobId(record.getString("jobId"))
                .uploadId(record.getString("uploadId"))
                .rowIndex(record.getInt("rowIndex"))
                .anomalyScore(record.getDouble("score"))
                .severity(Severity.valueOf(record.getString("severity")))
                .status(ReviewStatus.valueOf(record.getString("status")))
                .rowTimestamp(rowTs != null ? record.getLong("rowTs") : null)
                .featureValues(json.readRow(record.getString("features")))
                .explanation(json.readWeights(record.getString("explanation")))
                .modelLabel(record.getString("label"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
