package com.billing.leakdetector.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.billing.leakdetector.config.AerospikeConfig;
import com.billing.leakdetector.model.Upload;
import com.billing.leakdetector.repository.UploadRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upload metadata in {@code uploads}; rows are split into fixed-size chunks in
 * {@code upload_rows} to stay under the record size limit.
 */
@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeUploadRepository implements UploadRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeUploadRepository.class);

    static final int ROWS_PER_CHUNK = 500;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final JsonBins json;

    public AerospikeUploadRepository(AerospikeClient client,
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
    public void save(Upload upload, List<Map<String, Object>> rows) {
        int chunks = 0;
        for (int from = 0; from < rows.size(); from += ROWS_PER_CHUNK) {
            List<Map<String, Object>> chunk = rows.subList(from, Math.min(from + ROWS_PER_CHUNK, rows.size()));
            client.put(writePolicy, chunkKey(upload.getId(), chunks),
                    new Bin("uploadId", upload.getId()),
                    new Bin("chunk", chunks),
                    new Bin("rows", json.write(chunk)));
            chunks++;
        }

        // metadata last, so a visible upload always has all of its rows
        client.put(writePolicy, uploadKey(upload.getId()),
                new Bin("id", upload.getId()),
                new Bin("filename", upload.getFilename()),
                new Bin("rowsCount", upload.getRowsCount()),
                new Bin("columnsCount", upload.getColumnsCount()),
                new Bin("uploadedAt", upload.getUploadedAt()),
                new Bin("chunks", chunks));
        log.debug("Stored upload {} with {} rows in {} chunks", upload.getId(), rows.size(), chunks);
    }

    @Override
    public Optional<Upload> findById(String uploadId) {
        Record record = client.get(readPolicy, uploadKey(uploadId));
        if (record == null) return Optional.empty();
        return Optional.of(mapRecord(record));
    }

    @Override
    public boolean exists(String uploadId) {
        return client.exists(readPolicy, uploadKey(uploadId));
    }

    @Override
    public List<Map<String, Object>> loadRows(String uploadId) {
        Record meta = client.get(readPolicy, uploadKey(uploadId), "chunks");
        if (meta == null) return Collections.emptyList();

        int chunks = meta.getInt("chunks");
        if (chunks == 0) return Collections.emptyList();

        Key[] keys = new Key[chunks];
        for (int i = 0; i < chunks; i++) {
            keys[i] = chunkKey(uploadId, i);
        }
        Record[] records = client.get(null, keys);

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < records.length; i++) {
            if (records[i] == null) {
                throw new IllegalStateException("Upload " + uploadId + " is missing row chunk " + i);
            }
            rows.addAll(json.readRows(records[i].getString("rows")));
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public List<Upload> findAll() {
        List<Upload> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_UPLOADS,
                (key, record) -> {
                    try {
                        Upload upload = mapRecord(record);
                        synchronized (results) {
                            results.add(upload);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read upload record: {}", e.getMessage());
                    }
                });
        return results;
    }

    @Override
    public boolean delete(String uploadId) {
        Record meta = client.get(readPolicy, uploadKey(uploadId), "chunks");
        if (meta == null) return false;

        boolean deleted = client.delete(writePolicy, uploadKey(uploadId));
        int chunks = meta.getInt("chunks");
        for (int i = 0; i < chunks; i++) {
            client.delete(writePolicy, chunkKey(uploadId, i));
        }
        return deleted;
    }

    private Upload mapRecord(Record record) {
        return Upload.builder()
                .id(record.getString("id"))
                .filename(record.getString("filename"))
                .rowsCount(record.getInt("rowsCount"))
                .columnsCount(record.getInt("columnsCount"))
                .uploadedAt(record.getLong("uploadedAt"))
                .build();
    }

    private Key uploadKey(String uploadId) {
        return new Key(namespace, AerospikeConfig.SET_UPLOADS, uploadId);
    }

    private Key chunkKey(String uploadId, int chunk) {
        return new Key(namespace, AerospikeConfig.SET_UPLOAD_ROWS, uploadId + ":" + chunk);
    }
}
