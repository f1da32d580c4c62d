package com.billing.leakdetector.repository;

import com.billing.leakdetector.model.Job;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable ledger of processing jobs.
 */
public interface JobRepository {

    /**
     * Stores a new QUEUED job and claims its upload.
     *
     * @throws com.billing.leakdetector.exception.AlreadyProcessingException if another job of the
     *         same upload is still queued or running
     */
    Job create(Job job);

    /**
     * Atomically replaces the stored job with {@code transition.apply(current)}. The function may be
     * invoked more than once under contention and must not have side effects. When the result is
     * terminal the upload claim is released.
     *
     * @return the stored result
     * @throws com.billing.leakdetector.exception.NotFoundException for an unknown job
     */
    Job update(String jobId, UnaryOperator<Job> transition);

    /**
     * Takes the upload claim for an owner that is not a job, such as a deletion, so that
     * {@link #create} fails until {@link #unlockUpload} is called.
     *
     * @throws com.billing.leakdetector.exception.AlreadyProcessingException if a queued or running
     *         job or another lock holds the claim
     */
    void lockUpload(String uploadId, String ownerId);

    /** Releases a claim taken by {@link #lockUpload}; a no-op if {@code ownerId} no longer holds it. */
    void unlockUpload(String uploadId, String ownerId);

    Optional<Job> findById(String jobId);

    /** The queued or running job of an upload, if any. */
    Optional<Job> findActiveByUpload(String uploadId);

    List<Job> findByUpload(String uploadId);

    List<Job> findAll();

    /** Removes the jobs of an upload. A claim held through {@link #lockUpload} is left in place. */
    int deleteByUpload(String uploadId);
}
