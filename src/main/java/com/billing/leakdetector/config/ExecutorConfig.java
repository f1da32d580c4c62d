package com.billing.leakdetector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor processingExecutor(ProcessingConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorkerPoolSize());
        executor.setMaxPoolSize(config.getWorkerPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("job-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor inferenceExecutor(InferenceConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, config.getMaxConcurrency()));
        // timed-out calls keep a thread until the adapter returns, leave headroom for them
        executor.setMaxPoolSize(Math.max(1, config.getMaxConcurrency()) * 4);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("inference-");
        executor.initialize();
        return executor;
    }
}
