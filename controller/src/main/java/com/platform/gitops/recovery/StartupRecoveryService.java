package com.platform.gitops.recovery;

import com.platform.gitops.model.Kustomization;
import com.platform.gitops.observability.MetricsRegistry;
import com.platform.gitops.observability.StructuredLogger;
import com.platform.gitops.reconciliation.KustomizationStore;
import com.platform.gitops.reconciliation.ReconciliationScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resumes the reconcile loops of stored units on application startup.
 * 
 * Recovery Logic:
 * 1. Load every stored unit
 * 2. Trigger an attempt for each, suspended units included (the attempt parks them)
 * 3. Units marked for deletion get their finalizing pass
 * 
 * Nothing but the persisted status survives a restart.
 */
@Slf4j
@Component
public class StartupRecoveryService {
    
    private final KustomizationStore store;
    private final ReconciliationScheduler scheduler;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final boolean enabled;
    
    public StartupRecoveryService(KustomizationStore store,
                                  ReconciliationScheduler scheduler,
                                  MetricsRegistry metricsRegistry,
                                  StructuredLogger structuredLogger,
                                  @Value("${gitops.recovery.enabled:true}") boolean enabled) {
        this.store = store;
        this.scheduler = scheduler;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.enabled = enabled;
    }
    
    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE + 100)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!enabled) {
            log.info("Startup recovery disabled");
            return;
        }
        recover();
    }
    
    /**
     * @return number of units whose loop was started
     */
    public int recover() {
        List<Kustomization> units = store.findAll();
        structuredLogger.recovery().started(units.size());
        
        int scheduled = 0;
        int pendingDeletion = 0;
        int failed = 0;
        for (Kustomization unit : units) {
            try {
                if (unit.isBeingDeleted()) {
                    pendingDeletion++;
                }
                if (scheduler.trigger(unit.getKey())) {
                    scheduled++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to resume reconcile loop of {}", unit.getKey(), e);
            }
        }
        
        metricsRegistry.incrementCounter("gitops.recovery.completed",
            "scheduled", String.valueOf(scheduled),
            "failed", String.valueOf(failed));
        structuredLogger.recovery().completed(scheduled, pendingDeletion, failed);
        return scheduled;
    }
}
