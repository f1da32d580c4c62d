package com.billing.leakdetector.service;

import com.billing.leakdetector.config.ProcessingConfig;
import com.billing.leakdetector.engine.ProcessingEngine;
import com.billing.leakdetector.exception.InvalidTransitionException;
import com.billing.leakdetector.model.Job;
import com.billing.leakdetector.model.JobStatus;
import com.billing.leakdetector.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Fails jobs that can no longer finish on their own: running jobs past their deadline, and
 * jobs left queued or running by a previous process.
 */
@Service
public class JobWatchdogService {

    private static final Logger log = LoggerFactory.getLogger(JobWatchdogService.class);

    static final String ORPHANED_MESSAGE = "Job was interrupted by a service restart";

    private final JobRepository jobRepository;
    private final ProcessingEngine processingEngine;
    private final ProcessingConfig processingConfig;

    public JobWatchdogService(JobRepository jobRepository,
                              ProcessingEngine processingEngine,
                              ProcessingConfig processingConfig) {
        this.jobRepository = jobRepository;
        this.processingEngine = processingEngine;
        this.processingConfig = processingConfig;
    }

    @Scheduled(fixedRateString = "${leak.processing.watchdog-interval-seconds:10}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${leak.processing.watchdog-interval-seconds:10}")
    public void sweep() {
        long now = System.currentTimeMillis();
        long deadlineMs = TimeUnit.SECONDS.toMillis(processingConfig.getJobTimeoutSeconds());
        int timedOut = 0;
        int orphaned = 0;

        for (Job job : jobRepository.findAll()) {
            if (job.getStatus().isTerminal()) continue;

            try {
                if (isOrphan(job)) {
                    processingEngine.cancel(job.getId(), ORPHANED_MESSAGE);
                    orphaned++;
                } else if (deadlineMs > 0 && job.getStatus() == JobStatus.RUNNING
                        && job.getStartedAt() > 0 && now - job.getStartedAt() > deadlineMs) {
                    processingEngine.cancel(job.getId(), "Job exceeded its deadline of "
                            + processingConfig.getJobTimeoutSeconds() + " seconds");
                    timedOut++;
                }
            } catch (InvalidTransitionException e) {
                // finished between the scan and the cancel
                log.debug("Job {} finished before the watchdog acted: {}", job.getId(), e.getMessage());
            }
        }

        if (timedOut > 0 || orphaned > 0) {
            log.warn("Watchdog failed {} jobs past deadline and {} orphaned jobs", timedOut, orphaned);
        }
    }

    private boolean isOrphan(Job job) {
        return job.getCreatedAt() < processingEngine.getStartedAt() && !processingEngine.isLocal(job.getId());
    }
}
