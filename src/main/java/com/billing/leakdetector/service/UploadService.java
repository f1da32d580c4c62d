package com.billing.leakdetector.service;

import com.billing.leakdetector.exception.AlreadyProcessingException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.AnomalyFilter;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.PagedResponse;
import com.billing.leakdetector.model.Upload;
import com.billing.leakdetector.repository.ActionRepository;
import com.billing.leakdetector.repository.AnomalyRepository;
import com.billing.leakdetector.repository.JobRepository;
import com.billing.leakdetector.repository.UploadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Registration, lookup and cascading removal of datasets.
 */
@Service
public class UploadService {

    private static final Logger log = LoggerFactory.getLogger(UploadService.class);

    static final int MAX_PAGE_SIZE = 500;

    private final UploadRepository uploadRepository;
    private final JobRepository jobRepository;
    private final AnomalyRepository anomalyRepository;
    private final ActionRepository actionRepository;

    public UploadService(UploadRepository uploadRepository,
                         JobRepository jobRepository,
                         AnomalyRepository anomalyRepository,
                         ActionRepository actionRepository) {
        this.uploadRepository = uploadRepository;
        this.jobRepository = jobRepository;
        this.anomalyRepository = anomalyRepository;
        this.actionRepository = actionRepository;
    }

    public Upload register(String filename, List<Map<String, Object>> rows) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Dataset must contain at least one row");
        }

        Set<String> columns = new HashSet<>();
        for (Map<String, Object> row : rows) {
            if (row != null) {
                columns.addAll(row.keySet());
            }
        }

        Upload upload = Upload.builder()
                .id(UUID.randomUUID().toString())
                .filename(filename)
                .rowsCount(rows.size())
                .columnsCount(columns.size())
                .uploadedAt(System.currentTimeMillis())
                .build();
        uploadRepository.save(upload, rows);
        log.info("Registered upload {} ({}): {} rows, {} columns",
                upload.getId(), filename, upload.getRowsCount(), upload.getColumnsCount());
        return upload;
    }

    public Upload get(String uploadId) {
        return uploadRepository.findById(uploadId)
                .orElseThrow(() -> new NotFoundException("Upload", uploadId));
    }

    public List<Upload> list() {
        return uploadRepository.findAll();
    }

    public List<Job> jobsForUpload(String uploadId) {
        get(uploadId);
        return jobRepository.findByUpload(uploadId);
    }

    public PagedResponse<Anomaly> anomalies(String uploadId, AnomalyFilter filter, int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        return anomalyRepository.listByUpload(uploadId, filter, offset, limit);
    }

    /**
     * Removes the upload together with its rows, jobs, anomalies and actions. The upload claim is
     * held for the whole purge, so no job can be submitted for it meanwhile.
     *
     * @throws AlreadyProcessingException while a job of the upload is queued or running
     */
    public void delete(String uploadId) {
        get(uploadId);
        String lockId = "delete-" + UUID.randomUUID();
        jobRepository.lockUpload(uploadId, lockId);
        try {
            int actions = actionRepository.deleteByUpload(uploadId);
            int anomalies = anomalyRepository.deleteByUpload(uploadId);
            int jobs = jobRepository.deleteByUpload(uploadId);
            uploadRepository.delete(uploadId);
            log.info("Deleted upload {} with {} jobs, {} anomalies, {} actions", uploadId, jobs, anomalies, actions);
        } finally {
            jobRepository.unlockUpload(uploadId, lockId);
        }
    }
}
