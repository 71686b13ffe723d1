package com.platform.gitops.lifecycle;

import com.platform.gitops.observability.MetricsRegistry;
import com.platform.gitops.observability.StructuredLogger;
import com.platform.gitops.reconciliation.ReconciliationScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Graceful shutdown manager.
 * 
 * Order:
 * 1. Stop scheduling new attempts
 * 2. Wait for in-flight attempts, so that their status is written
 * 3. Interrupt what is left and stop the attempt executor
 * 
 * An attempt interrupted here leaves the status of its previous attempt; the next start
 * simply runs it again.
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
    
    private final ReconciliationScheduler scheduler;
    private final ExecutorService attemptExecutor;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Duration shutdownTimeout;
    
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    
    public GracefulShutdownManager(ReconciliationScheduler scheduler,
                                   @Qualifier("attemptExecutor") ExecutorService attemptExecutor,
                                   MetricsRegistry metricsRegistry,
                                   StructuredLogger structuredLogger,
                                   @Value("${gitops.shutdown.timeout:30s}") Duration shutdownTimeout) {
        this.scheduler = scheduler;
        this.attemptExecutor = attemptExecutor;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.shutdownTimeout = shutdownTimeout;
    }
    
    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }
    
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
    
    /**
     * @return true when every in-flight attempt finished within the timeout
     */
    public boolean performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return true;
        }
        
        Instant start = Instant.now();
        log.info("========== GRACEFUL SHUTDOWN INITIATED ==========");
        
        boolean clean = false;
        try {
            log.info("[1/3] Stopping reconcile loops...");
            scheduler.shutdown();
            
            log.info("[2/3] Waiting for in-flight attempts...");
            structuredLogger.lifecycle().draining(scheduler.inFlightCount());
            clean = scheduler.awaitInFlight(shutdownTimeout);
            if (!clean) {
                log.warn("Timeout waiting for {} in-flight attempts", scheduler.inFlightCount());
            }
            
            log.info("[3/3] Stopping attempt executor...");
            attemptExecutor.shutdownNow();
            if (!attemptExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Attempt executor did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for in-flight attempts");
        }
        
        long drainMs = Duration.between(start, Instant.now()).toMillis();
        metricsRegistry.incrementCounter("gitops.lifecycle.shutdown", "clean", String.valueOf(clean));
        structuredLogger.lifecycle().shutdown(drainMs, clean);
        log.info("========== GRACEFUL SHUTDOWN COMPLETE ({} ms) ==========", drainMs);
        return clean;
    }
}
