package com.billing.leakdetector.engine;

import com.billing.leakdetector.config.DetectionConfig;
import com.billing.leakdetector.config.MetricsConfig;
import com.billing.leakdetector.config.ProcessingConfig;
import com.billing.leakdetector.exception.DuplicateRowException;
import com.billing.leakdetector.exception.InvalidRowException;
import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.inference.InferenceGateway;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.ReviewStatus;
import com.billing.leakdetector.model.ScoreResult;
import com.billing.leakdetector.model.Severity;
import com.billing.leakdetector.model.Upload;
import com.billing.leakdetector.repository.AnomalyRepository;
import com.billing.leakdetector.repository.JobRepository;
import com.billing.leakdetector.repository.UploadRepository;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs processing jobs on the worker pool.
 *
 * <p>A job walks its upload's rows in order, scoring each row through the
 * {@link InferenceGateway} and storing the result as an {@link Anomaly}. Progress is written
 * after every batch. Malformed rows are skipped and counted; once they exceed the configured
 * fraction of the dataset, or when the adapter or the store fails, the job ends FAILED and
 * everything stored so far stays queryable.
 *
 * <p>Rows an earlier run of the same upload already stored are not scored again. They count
 * toward progress and toward the final anomaly count.
 */
@Service
public class ProcessingEngine {

    private static final Logger log = LoggerFactory.getLogger(ProcessingEngine.class);

    static final String CANCELLED_MESSAGE = "Cancelled by user";
    static final String UPLOAD_DELETED_MESSAGE = "Upload was deleted before the job started";
    static final String REJECTED_MESSAGE = "Worker pool is saturated, job was not started";

    private final UploadRepository uploadRepository;
    private final JobRepository jobRepository;
    private final AnomalyRepository anomalyRepository;
    private final InferenceGateway inferenceGateway;
    private final RowValidator rowValidator;
    private final SeverityPolicy severityPolicy;
    private final ProcessingConfig processingConfig;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final AsyncTaskExecutor executor;

    private final Map<String, JobHandle> handles = new ConcurrentHashMap<>();
    private final long startedAt = System.currentTimeMillis();

    @Autowired
    public ProcessingEngine(UploadRepository uploadRepository,
                            JobRepository jobRepository,
                            AnomalyRepository anomalyRepository,
                            InferenceGateway inferenceGateway,
                            RowValidator rowValidator,
                            SeverityPolicy severityPolicy,
                            ProcessingConfig processingConfig,
                            DetectionConfig detectionConfig,
                            MetricsConfig metricsConfig,
                            ObjectProvider<Tracer> tracer,
                            @Qualifier("processingExecutor") AsyncTaskExecutor executor) {
        // no Tracer bean when tracing is switched off
        this(uploadRepository, jobRepository, anomalyRepository, inferenceGateway, rowValidator, severityPolicy,
                processingConfig, detectionConfig, metricsConfig, tracer.getIfAvailable(() -> Tracer.NOOP), executor);
    }

    ProcessingEngine(UploadRepository uploadRepository,
                     JobRepository jobRepository,
                     AnomalyRepository anomalyRepository,
                     InferenceGateway inferenceGateway,
                     RowValidator rowValidator,
                     SeverityPolicy severityPolicy,
                     ProcessingConfig processingConfig,
                     DetectionConfig detectionConfig,
                     MetricsConfig metricsConfig,
                     Tracer tracer,
                     AsyncTaskExecutor executor) {
        this.uploadRepository = uploadRepository;
        this.jobRepository = jobRepository;
        this.anomalyRepository = anomalyRepository;
        this.inferenceGateway = inferenceGateway;
        this.rowValidator = rowValidator;
        this.severityPolicy = severityPolicy;
        this.processingConfig = processingConfig;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.executor = executor;
    }

    /**
     * Creates a QUEUED job for the upload and hands it to the worker pool.
     *
     * @return the job as accepted
     * @throws NotFoundException if the upload is not registered
     * @throws com.billing.leakdetector.exception.AlreadyProcessingException if the upload already
     *         has a queued or running job
     */
    @Observed(name = "job.submit", contextualName = "submit-job")
    public Job submit(String uploadId) {
        Upload upload = uploadRepository.findById(uploadId)
                .orElseThrow(() -> new NotFoundException("Upload", uploadId));

        Job job = jobRepository.create(JobStateMachine.queued(
                UUID.randomUUID().toString(), uploadId, upload.getRowsCount(), System.currentTimeMillis()));
        if (!uploadRepository.exists(uploadId)) {
            // deleted between the lookup and the claim
            failQuietly(job.getId(), UPLOAD_DELETED_MESSAGE);
            jobRepository.deleteByUpload(uploadId);
            throw new NotFoundException("Upload", uploadId);
        }
        metricsConfig.recordJobTransition(job.getStatus().name());
        log.info("Job {} queued for upload {} ({} rows)", job.getId(), uploadId, upload.getRowsCount());

        JobHandle handle = new JobHandle(job.getId(), uploadId);
        handles.put(job.getId(), handle);
        try {
            handle.attach(executor.submit(() -> run(handle)));
        } catch (TaskRejectedException e) {
            handles.remove(job.getId());
            log.warn("Job {} rejected by the worker pool: {}", job.getId(), e.getMessage());
            Job failed = failQuietly(job.getId(), REJECTED_MESSAGE);
            return failed != null ? failed : job;
        }
        return job;
    }

    /**
     * Moves a queued or running job to FAILED right away, then stops its worker. Rows already
     * stored are kept.
     *
     * @throws NotFoundException for an unknown job
     * @throws InvalidTransitionException if the job already finished
     */
    public Job cancel(String jobId) {
        return cancel(jobId, CANCELLED_MESSAGE);
    }

    public Job cancel(String jobId, String reason) {
        JobHandle handle = handles.get(jobId);
        if (handle != null) {
            // set before the write so the worker treats the FAILED it may observe as a cancellation
            handle.markCancelled();
        }
        Job failed = jobRepository.update(jobId, JobStateMachine.fail(reason, System.currentTimeMillis()));
        metricsConfig.recordJobTransition(failed.getStatus().name());
        if (handle != null) {
            if (handle.markStarted()) {
                // the worker never began and will return immediately if it does
                handles.remove(jobId);
            }
            handle.interrupt();
        }
        log.info("Job {} of upload {} cancelled: {}", jobId, failed.getUploadId(), reason);
        return failed;
    }

    public Job getJob(String jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    /** Whether this process is currently running or queuing the job. */
    public boolean isLocal(String jobId) {
        return handles.containsKey(jobId);
    }

    public long getStartedAt() {
        return startedAt;
    }

    private void run(JobHandle handle) {
        String jobId = handle.jobId();
        if (!handle.markStarted()) {
            return;
        }
        if (handle.isCancelled()) {
            handles.remove(jobId);
            return;
        }

        Job job;
        try {
            job = jobRepository.update(jobId, JobStateMachine.claim(System.currentTimeMillis()));
        } catch (InvalidTransitionException e) {
            log.info("Job {} is no longer queued, not starting: {}", jobId, e.getMessage());
            handles.remove(jobId);
            return;
        } catch (RuntimeException e) {
            log.error("Job {} could not be claimed: {}", jobId, e.getMessage(), e);
            handles.remove(jobId);
            failQuietly(jobId, e.getMessage());
            return;
        }

        metricsConfig.recordJobTransition(job.getStatus().name());
        metricsConfig.jobStarted();
        log.info("Job {} running for upload {}", jobId, job.getUploadId());

        Span span = tracer.nextSpan()
                .name("job.process")
                .tag("job.id", jobId)
                .tag("upload.id", job.getUploadId())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            Job done = process(handle, job);
            metricsConfig.recordJobTransition(done.getStatus().name());
            metricsConfig.recordJobDuration(done.getStatus().name(), done.getProcessingTimeSeconds());
            log.info("Job {} completed: {} rows, {} anomalies stored, {} skipped in {}s",
                    jobId, done.getRowsProcessed(), done.getAnomaliesFound(),
                    done.getSkippedRows(), done.getProcessingTimeSeconds());
        } catch (Exception e) {
            span.error(e);
            if (handle.isCancelled()) {
                log.info("Job {} stopped after cancellation", jobId);
            } else {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Job {} failed: {}", jobId, message, e);
                Job failed = failQuietly(jobId, message);
                if (failed != null) {
                    metricsConfig.recordJobDuration(failed.getStatus().name(), failed.getProcessingTimeSeconds());
                }
            }
        } finally {
            span.end();
            metricsConfig.jobFinished();
            handles.remove(jobId);
        }
    }

    private Job process(JobHandle handle, Job job) {
        String jobId = job.getId();
        String uploadId = job.getUploadId();
        List<Map<String, Object>> rows = uploadRepository.loadRows(uploadId);
        int total = rows.size();

        Set<Integer> alreadyStored = anomalyRepository.findRowIndexes(uploadId);
        if (!alreadyStored.isEmpty()) {
            log.info("Job {} resuming upload {}: {} of {} rows already stored",
                    jobId, uploadId, alreadyStored.size(), total);
        }

        int batchSize = Math.max(1, processingConfig.getBatchSize());
        long maxSkipped = (long) Math.floor(processingConfig.getMaxSkippedFraction() * total);
        int processed = 0;
        int skipped = 0;

        for (int batchStart = 0; batchStart < total; batchStart += batchSize) {
            int batchEnd = Math.min(batchStart + batchSize, total);
            int scoredInBatch = 0;

            for (int rowIndex = batchStart; rowIndex < batchEnd; rowIndex++) {
                checkCancelled(handle);
                if (!alreadyStored.contains(rowIndex)) {
                    try {
                        scoreRow(job, rowIndex, rows.get(rowIndex));
                        scoredInBatch++;
                    } catch (InvalidRowException e) {
                        skipped++;
                        metricsConfig.recordRowSkipped("invalid");
                        log.warn("Job {} skipped row {}: {}", jobId, rowIndex, e.getMessage());
                        if (skipped > maxSkipped) {
                            throw new IllegalStateException("Corrupt rows beyond tolerance: "
                                    + skipped + " of " + total + " rows could not be scored");
                        }
                    } catch (DuplicateRowException e) {
                        log.debug("Job {} found row {} already stored", jobId, rowIndex);
                    }
                }
                processed++;
            }

            checkCancelled(handle);
            jobRepository.update(jobId, JobStateMachine.advance(processed, skipped, System.currentTimeMillis()));
            metricsConfig.recordRowsScored(scoredInBatch);
            log.debug("Job {} progress: {}/{} rows", jobId, processed, total);
        }

        int anomalies = (int) anomalyRepository.countByUpload(uploadId);
        return jobRepository.update(jobId,
                JobStateMachine.complete(processed, anomalies, skipped, System.currentTimeMillis()));
    }

    private void scoreRow(Job job, int rowIndex, Map<String, Object> row) {
        rowValidator.validate(rowIndex, row);

        ScoreResult result = inferenceGateway.score(row);
        double score = result.anomalyScore();
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new InvalidRowException("Row " + rowIndex + " scored outside [0, 1]: " + score);
        }

        Severity severity = severityPolicy.classify(score);
        long now = System.currentTimeMillis();
        anomalyRepository.put(Anomaly.builder()
                .id(Anomaly.idFor(job.getUploadId(), rowIndex))
                .jobId(job.getId())
                .uploadId(job.getUploadId())
                .rowIndex(rowIndex)
                .anomalyScore(score)
                .severity(severity)
                .status(ReviewStatus.UNREVIEWED)
                .rowTimestamp(RowValues.timestamp(row, detectionConfig.getTimestampColumn()))
                .featureValues(new LinkedHashMap<>(row))
                .modelLabel(result.label())
                .createdAt(now)
                .updatedAt(now)
                .build());
        metricsConfig.recordScore(severity.name(), score);
    }

    private void checkCancelled(JobHandle handle) {
        if (handle.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Job " + handle.jobId() + " was interrupted");
        }
    }

    /** Records FAILED unless the job already reached a terminal state. */
    private Job failQuietly(String jobId, String message) {
        try {
            Job failed = jobRepository.update(jobId, JobStateMachine.fail(message, System.currentTimeMillis()));
            metricsConfig.recordJobTransition(failed.getStatus().name());
            return failed;
        } catch (InvalidTransitionException e) {
            log.info("Job {} already finished, failure not recorded: {}", jobId, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}: {}", jobId, e.getMessage(), e);
            return null;
        }
    }
}
