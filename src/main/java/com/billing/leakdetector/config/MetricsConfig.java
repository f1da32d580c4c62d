package com.billing.leakdetector.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeJobs;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeJobs = registry.gauge("jobs.active", new AtomicInteger(0));
    }

    public void recordJobTransition(String status) {
        Counter.builder("jobs.transition.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordJobDuration(String status, double seconds) {
        DistributionSummary.builder("jobs.duration.seconds")
                .tag("status", status)
                .register(registry)
                .record(seconds);
    }

    public void recordRowsScored(int count) {
        Counter.builder("rows.scored.count")
                .register(registry)
                .increment(count);
    }

    public void recordRowSkipped(String reason) {
        Counter.builder("rows.skipped.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordScore(String severity, double score) {
        DistributionSummary.builder("anomaly.score")
                .tag("severity", severity)
                .register(registry)
                .record(score);
    }

    public void recordExplanation(boolean cacheHit) {
        Counter.builder("explanation.request.count")
                .tag("cache", cacheHit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordAction(String actionType) {
        Counter.builder("action.recorded.count")
                .tag("action_type", actionType)
                .register(registry)
                .increment();
    }

    public void recordAdapterFailure(String kind) {
        Counter.builder("inference.failure.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void jobStarted() {
        activeJobs.incrementAndGet();
    }

    public void jobFinished() {
        activeJobs.decrementAndGet();
    }
}
