package com.platform.gitops.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools of the reconcile loops.
 * 
 * The task scheduler runs the per-unit loops and blocks while an attempt is in flight, so its
 * size bounds the number of concurrent attempts. Attempt bodies run on the attempt executor,
 * which is larger so that a body still unwinding after a timeout does not starve the next one.
 */
@Slf4j
@Configuration
public class SchedulerConfig {
    
    @Bean(name = "reconcileTaskScheduler")
    public ThreadPoolTaskScheduler reconcileTaskScheduler(
            @Value("${gitops.reconcile.concurrency:4}") int concurrency) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(concurrency);
        scheduler.setThreadNamePrefix("reconcile-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        log.info("Reconcile scheduler initialized (concurrency={})", concurrency);
        return scheduler;
    }
    
    @Bean(name = "attemptExecutor", destroyMethod = "shutdownNow")
    public ExecutorService attemptExecutor(@Value("${gitops.reconcile.concurrency:4}") int concurrency) {
        return Executors.newFixedThreadPool(concurrency * 2, new CustomizableThreadFactory("attempt-"));
    }
}
