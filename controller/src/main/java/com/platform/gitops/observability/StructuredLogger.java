package com.platform.gitops.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Structured audit logger for reconciliation outcomes and controller lifecycle.
 * All events are JSON-formatted and machine-parsable.
 */
@Component
public class StructuredLogger {
    
    private final String serviceName;
    private final String environment;
    
    public StructuredLogger(@Value("${otel.service.name:gitops-controller}") String serviceName,
                            @Value("${otel.environment:development}") String environment) {
        this.serviceName = serviceName;
        this.environment = environment;
    }
    
    /**
     * Get reconciliation event logger.
     */
    public ReconcileLogger reconcile() {
        return new ReconcileLogger(serviceName, environment);
    }
    
    /**
     * Get unit management event logger.
     */
    public UnitLogger unit() {
        return new UnitLogger(serviceName, environment);
    }
    
    /**
     * Get lifecycle event logger.
     */
    public LifecycleLogger lifecycle() {
        return new LifecycleLogger(serviceName, environment);
    }
    
    /**
     * Get recovery event logger.
     */
    public RecoveryLogger recovery() {
        return new RecoveryLogger(serviceName, environment);
    }
    
    // ==================== RECONCILE LOGGER ====================
    
    public static class ReconcileLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.reconcile");
        private final String service;
        private final String environment;
        
        ReconcileLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void started(String unit, long generation) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_STARTED, "DEBUG")
                .actor("controller")
                .unit(unit)
                .attributes(Map.of("generation", generation))
                .build();
            log.debug(event.toJson());
        }
        
        public void succeeded(String unit, String revision, String changeSet, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_SUCCEEDED, "INFO")
                .actor("controller")
                .unit(unit)
                .revision(revision)
                .success(true)
                .durationMs(durationMs)
                .message(changeSet)
                .build();
            log.info(event.toJson());
        }
        
        public void failed(String unit, String reason, String errorCode, String errorMessage, long durationMs) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_FAILED, "ERROR")
                .actor("controller")
                .unit(unit)
                .reason(reason)
                .success(false)
                .durationMs(durationMs)
                .errorCode(errorCode)
                .detail(errorMessage)
                .build();
            log.error(event.toJson());
        }
        
        public void deferred(String unit) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECONCILE_DEFERRED, "DEBUG")
                .actor("scheduler")
                .unit(unit)
                .message("attempt in flight, trigger deferred")
                .build();
            log.debug(event.toJson());
        }
        
        public void objectApplied(String object, String action) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.OBJECT_APPLIED, "INFO")
                .actor("controller")
                .object(object)
                .message(action)
                .build();
            log.info(event.toJson());
        }
        
        public void objectPruned(String object) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.OBJECT_PRUNED, "INFO")
                .actor("controller")
                .object(object)
                .message("deleted")
                .build();
            log.info(event.toJson());
        }
        
        public void finalized(String unit, int pruned) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.UNIT_FINALIZED, "INFO")
                .actor("controller")
                .unit(unit)
                .success(true)
                .attributes(Map.of("pruned", pruned))
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== UNIT LOGGER ====================
    
    public static class UnitLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.unit");
        private final String service;
        private final String environment;
        
        UnitLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void created(String unit, String actor) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.UNIT_CREATED, "INFO")
                .actor(actor)
                .unit(unit)
                .build();
            log.info(event.toJson());
        }
        
        public void updated(String unit, long generation, String actor) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.UNIT_UPDATED, "INFO")
                .actor(actor)
                .unit(unit)
                .attributes(Map.of("generation", generation))
                .build();
            log.info(event.toJson());
        }
        
        public void deletionRequested(String unit, String actor) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.UNIT_DELETION_REQUESTED, "INFO")
                .actor(actor)
                .unit(unit)
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== LIFECYCLE LOGGER ====================
    
    public static class LifecycleLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.lifecycle");
        private final String service;
        private final String environment;
        
        LifecycleLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void draining(int inFlight) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.APP_DRAINING, "INFO")
                .actor("system")
                .attributes(Map.of("in_flight", inFlight))
                .build();
            log.info(event.toJson());
        }
        
        public void shutdown(long drainMs, boolean clean) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.APP_SHUTDOWN, "INFO")
                .actor("system")
                .success(clean)
                .durationMs(drainMs)
                .build();
            log.info(event.toJson());
        }
    }
    
    // ==================== RECOVERY LOGGER ====================
    
    public static class RecoveryLogger {
        private static final Logger log = LoggerFactory.getLogger("structured.recovery");
        private final String service;
        private final String environment;
        
        RecoveryLogger(String service, String environment) {
            this.service = service;
            this.environment = environment;
        }
        
        public void started(int storedUnits) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECOVERY_STARTED, "INFO")
                .actor("system")
                .attributes(Map.of("stored_units", storedUnits))
                .build();
            log.info(event.toJson());
        }
        
        public void completed(int scheduled, int pendingDeletion, int failed) {
            StructuredLogEvent event = StructuredLogEvent.fromContext(service, environment,
                    LogEventType.RECOVERY_COMPLETED, "INFO")
                .actor("system")
                .attributes(Map.of(
                    "scheduled", scheduled,
                    "pending_deletion", pendingDeletion,
                    "failed", failed
                ))
                .build();
            log.info(event.toJson());
        }
    }
}
