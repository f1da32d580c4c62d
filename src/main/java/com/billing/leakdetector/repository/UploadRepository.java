package com.billing.leakdetector.repository;

import com.billing.leakdetector.model.Upload;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered datasets and their materialized rows.
 */
public interface UploadRepository {

    void save(Upload upload, List<Map<String, Object>> rows);

    Optional<Upload> findById(String uploadId);

    boolean exists(String uploadId);

    /** Rows in their original order. Empty if the upload is unknown. */
    List<Map<String, Object>> loadRows(String uploadId);

    List<Upload> findAll();

    boolean delete(String uploadId);
}
