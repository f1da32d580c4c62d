package com.billing.leakdetector.repository.memory;

import com.billing.leakdetector.model.Upload;
import com.billing.leakdetector.repository.UploadRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local upload store for tests and single-node development runs.
 */
@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "memory")
public class InMemoryUploadRepository implements UploadRepository {

    private final Map<String, Upload> uploads = new ConcurrentHashMap<>();
    private final Map<String, List<Map<String, Object>>> rows = new ConcurrentHashMap<>();

    @Override
    public void save(Upload upload, List<Map<String, Object>> data) {
        List<Map<String, Object>> copy = new ArrayList<>(data.size());
        for (Map<String, Object> row : data) {
            // null rows are kept so that processing skips and counts them
            copy.add(row == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows.put(upload.getId(), Collections.unmodifiableList(copy));
        uploads.put(upload.getId(), upload);
    }

    @Override
    public Optional<Upload> findById(String uploadId) {
        return Optional.ofNullable(uploads.get(uploadId));
    }

    @Override
    public boolean exists(String uploadId) {
        return uploads.containsKey(uploadId);
    }

    @Override
    public List<Map<String, Object>> loadRows(String uploadId) {
        return rows.getOrDefault(uploadId, Collections.emptyList());
    }

    @Override
    public List<Upload> findAll() {
        return new ArrayList<>(uploads.values());
    }

    @Override
    public boolean delete(String uploadId) {
        rows.remove(uploadId);
        return uploads.remove(uploadId) != null;
    }
}
