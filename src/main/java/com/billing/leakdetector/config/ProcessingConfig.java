package com.billing.leakdetector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "leak.processing")
public class ProcessingConfig {

    // Rows scored between two progress updates.
    private int batchSize = 100;

    // Jobs that may run at the same time. Each job occupies one worker for its whole run.
    private int workerPoolSize = 4;

    // Accepted jobs waiting for a free worker. Submissions beyond this fail the job immediately.
    private int queueCapacity = 100;

    // Fraction of rows (0..1) that may be skipped as malformed before the job is failed.
    // 1.0 never fails a job for malformed rows.
    private double maxSkippedFraction = 1.0;

    // Running jobs older than this are cancelled by the watchdog. 0 disables the deadline.
    private long jobTimeoutSeconds = 1800;

    private int watchdogIntervalSeconds = 10;
}
