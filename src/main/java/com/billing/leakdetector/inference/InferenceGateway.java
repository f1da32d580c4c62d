package com.billing.leakdetector.inference;

import com.billing.leakdetector.config.InferenceConfig;
import com.billing.leakdetector.config.MetricsConfig;
import com.billing.leakdetector.exception.AdapterUnavailableException;
import com.billing.leakdetector.exception.InvalidRowException;
import com.billing.leakdetector.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Single entry point into the {@link InferenceAdapter}.
 *
 * <p>At most {@code leak.inference.max-concurrency} calls are inside the adapter at any time.
 * A permit is held until the adapter actually returns, including after the caller has given up
 * on a timed-out call, so a single-threaded model never sees overlapping calls.
 */
@Component
public class InferenceGateway {

    private static final Logger log = LoggerFactory.getLogger(InferenceGateway.class);

    private final InferenceAdapter adapter;
    private final AsyncTaskExecutor executor;
    private final MetricsConfig metricsConfig;
    private final Semaphore permits;
    private final long timeoutMs;
    private final InferenceConfig.TimeoutPolicy timeoutPolicy;

    public InferenceGateway(InferenceAdapter adapter,
                            @Qualifier("inferenceExecutor") AsyncTaskExecutor executor,
                            InferenceConfig config,
                            MetricsConfig metricsConfig) {
        this.adapter = adapter;
        this.executor = executor;
        this.metricsConfig = metricsConfig;
        this.permits = new Semaphore(Math.max(1, config.getMaxConcurrency()), true);
        this.timeoutMs = config.getTimeoutMs();
        this.timeoutPolicy = config.getTimeoutPolicy();
        log.info("Inference gateway: adapter={}, maxConcurrency={}, timeoutMs={}, timeoutPolicy={}",
                adapter.name(), config.getMaxConcurrency(), timeoutMs, timeoutPolicy);
    }

    public ScoreResult score(Map<String, Object> row) {
        return call("score", () -> adapter.score(row));
    }

    public Map<String, Double> explain(Map<String, Object> row) {
        return call("explain", () -> adapter.explain(row));
    }

    public String adapterName() {
        return adapter.name();
    }

    private <T> T call(String operation, Supplier<T> invocation) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterUnavailableException("Interrupted while waiting for the inference adapter", e);
        }

        if (timeoutMs <= 0) {
            try {
                return invocation.get();
            } finally {
                permits.release();
            }
        }

        // whoever flips this first owns the permit release
        AtomicBoolean started = new AtomicBoolean(false);
        Future<T> future;
        try {
            future = executor.submit(() -> {
                if (!started.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return invocation.get();
                } finally {
                    permits.release();
                }
            });
        } catch (TaskRejectedException e) {
            permits.release();
            metricsConfig.recordAdapterFailure("rejected");
            throw new AdapterUnavailableException("Inference executor is saturated", e);
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, started);
            metricsConfig.recordAdapterFailure("timeout");
            String message = "Inference " + operation + " timed out after " + timeoutMs + " ms";
            if (timeoutPolicy == InferenceConfig.TimeoutPolicy.SKIP_ROW) {
                throw new InvalidRowException(message, e);
            }
            throw new AdapterUnavailableException(message, e);
        } catch (InterruptedException e) {
            abandon(future, started);
            Thread.currentThread().interrupt();
            throw new AdapterUnavailableException("Interrupted during inference " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidRowException invalid) {
                throw invalid;
            }
            metricsConfig.recordAdapterFailure("error");
            if (cause instanceof AdapterUnavailableException unavailable) {
                throw unavailable;
            }
            throw new AdapterUnavailableException("Inference " + operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private void abandon(Future<?> future, AtomicBoolean started) {
        future.cancel(true);
        if (started.compareAndSet(false, true)) {
            // never ran, so the task will not release
            permits.release();
        }
    }
}
