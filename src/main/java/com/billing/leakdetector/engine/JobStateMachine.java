package com.billing.leakdetector.engine;

import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.JobStatus;

import java.util.function.UnaryOperator;

/**
 * Transition functions for {@link Job}. Each returns an operator suitable for
 * {@link com.billing.leakdetector.repository.JobRepository#update}: it validates the
 * transition against the state it is handed and produces the next snapshot without side effects.
 */
public final class JobStateMachine {

    private JobStateMachine() {
    }

    public static Job queued(String jobId, String uploadId, int rowsTotal, long now) {
        return Job.builder()
                .id(jobId)
                .uploadId(uploadId)
                .status(JobStatus.QUEUED)
                .progress(0)
                .rowsTotal(rowsTotal)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /** QUEUED -> RUNNING when a worker picks the job up. */
    public static UnaryOperator<Job> claim(long now) {
        return current -> {
            if (current.getStatus() != JobStatus.QUEUED) {
                throw new InvalidTransitionException("job " + current.getId(), current.getStatus(), JobStatus.RUNNING);
            }
            return current.toBuilder()
                    .status(JobStatus.RUNNING)
                    .progress(0)
                    .startedAt(now)
                    .updatedAt(now)
                    .build();
        };
    }

    /** RUNNING -> RUNNING after a batch. Progress never moves backwards. */
    public static UnaryOperator<Job> advance(int rowsProcessed, int skippedRows, long now) {
        return current -> {
            if (current.getStatus() != JobStatus.RUNNING) {
                throw new InvalidTransitionException("job " + current.getId(), current.getStatus(), JobStatus.RUNNING);
            }
            int progress = Math.max(current.getProgress(), progressOf(rowsProcessed, current.getRowsTotal()));
            return current.toBuilder()
                    .progress(progress)
                    .rowsProcessed(Math.max(current.getRowsProcessed(), rowsProcessed))
                    .skippedRows(skippedRows)
                    .updatedAt(now)
                    .build();
        };
    }

    public static UnaryOperator<Job> complete(int rowsProcessed, int anomaliesFound, int skippedRows, long now) {
        return current -> {
            require(current, JobStatus.COMPLETED);
            return current.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .progress(100)
                    .rowsProcessed(rowsProcessed)
                    .anomaliesFound(anomaliesFound)
                    .skippedRows(skippedRows)
                    .processingTimeSeconds(elapsedSeconds(current, now))
                    .completedAt(now)
                    .updatedAt(now)
                    .build();
        };
    }

    /** QUEUED or RUNNING -> FAILED. The message is stored as given. */
    public static UnaryOperator<Job> fail(String errorMessage, long now) {
        return current -> {
            require(current, JobStatus.FAILED);
            return current.toBuilder()
                    .status(JobStatus.FAILED)
                    .errorMessage(errorMessage)
                    .processingTimeSeconds(elapsedSeconds(current, now))
                    .completedAt(now)
                    .updatedAt(now)
                    .build();
        };
    }

    static int progressOf(int rowsProcessed, int rowsTotal) {
        if (rowsTotal <= 0) return 100;
        return (int) Math.min(100, (long) rowsProcessed * 100 / rowsTotal);
    }

    private static void require(Job current, JobStatus target) {
        if (!current.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException("job " + current.getId(), current.getStatus(), target);
        }
    }

    private static double elapsedSeconds(Job job, long now) {
        if (job.getStartedAt() <= 0) return 0.0;
        return Math.round((now - job.getStartedAt()) / 10.0) / 100.0;
    }
}
