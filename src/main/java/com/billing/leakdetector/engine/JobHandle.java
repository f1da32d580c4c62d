package com.billing.leakdetector.engine;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local control block of a submitted job.
 */
final class JobHandle {

    private final String jobId;
    private final String uploadId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Future<?> future;

    JobHandle(String jobId, String uploadId) {
        this.jobId = jobId;
        this.uploadId = uploadId;
    }

    String jobId() {
        return jobId;
    }

    String uploadId() {
        return uploadId;
    }

    void attach(Future<?> future) {
        this.future = future;
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    void markCancelled() {
        cancelled.set(true);
    }

    /** Interrupts the worker if the job has started. */
    void interrupt() {
        Future<?> current = future;
        if (current != null) {
            current.cancel(true);
        }
    }

    /**
     * Claims the right to run. Returns false if the worker or a cancellation got there first;
     * whoever wins is responsible for dropping the handle.
     */
    boolean markStarted() {
        return started.compareAndSet(false, true);
    }

    boolean isCancelled() {
        return cancelled.get();
    }
}
