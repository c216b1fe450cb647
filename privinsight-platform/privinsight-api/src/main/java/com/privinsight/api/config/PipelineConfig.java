package com.privinsight.api.config;

import com.privinsight.api.job.JobCoordinatorConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure: the pipeline clock, the pool the local computation backend runs on,
 * and the pool that handles computation results off the backend's threads.
 */
@Configuration
@EnableScheduling
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "jobCallbackExecutor", destroyMethod = "shutdown")
    public ExecutorService jobCallbackExecutor(JobCoordinatorConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "job-callback-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(config.getCallbackThreads(), threadFactory);
    }

    @Bean(name = "computationExecutor", destroyMethod = "shutdown")
    public ExecutorService computationExecutor(JobCoordinatorConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "computation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(config.getComputationThreads(), threadFactory);
    }
}
