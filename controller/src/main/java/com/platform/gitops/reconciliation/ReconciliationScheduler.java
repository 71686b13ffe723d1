package com.platform.gitops.reconciliation;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.observability.MetricsRegistry;
import com.platform.gitops.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives one reconcile loop per unit.
 * 
 * Rules:
 * - at most one attempt per unit runs at a time
 * - a trigger for a unit in flight is deferred and runs once after the attempt
 * - success requeues after the interval, failure after the retry interval, a dependency that is
 *   not ready after the dependency requeue interval
 * - a suspended unit is parked until the next explicit trigger
 * - a finalized or vanished unit leaves the schedule
 */
@Slf4j
@Service
public class ReconciliationScheduler {
    
    private final KustomizationReconciler reconciler;
    private final KustomizationStore store;
    private final TaskScheduler taskScheduler;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final Duration dependencyRequeueInterval;
    
    private final Map<UnitKey, ScheduledFuture<?>> pending = new HashMap<>();
    private final Set<UnitKey> inFlight = new HashSet<>();
    private final Set<UnitKey> deferred = new HashSet<>();
    private final Set<UnitKey> parked = new HashSet<>();
    private boolean stopping;
    
    public ReconciliationScheduler(KustomizationReconciler reconciler,
                                   KustomizationStore store,
                                   @Qualifier("reconcileTaskScheduler") TaskScheduler taskScheduler,
                                   MetricsRegistry metricsRegistry,
                                   StructuredLogger structuredLogger,
                                   Clock clock,
                                   @Value("${gitops.dependency.requeue-interval:30s}") Duration dependencyRequeueInterval) {
        this.reconciler = reconciler;
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.dependencyRequeueInterval = dependencyRequeueInterval;
    }
    
    /**
     * Requests an attempt now. Wakes a parked unit.
     *
     * @return false when the unit is in flight and the trigger was deferred, or when stopping
     */
    public synchronized boolean trigger(UnitKey key) {
        if (stopping) {
            return false;
        }
        parked.remove(key);
        if (inFlight.contains(key)) {
            deferred.add(key);
            metricsRegistry.recordDeferredTrigger(key.toString());
            structuredLogger.reconcile().deferred(key.toString());
            return false;
        }
        scheduleAt(key, clock.instant());
        return true;
    }
    
    /**
     * Schedules every stored unit that has no loop yet. Parked units stay parked.
     */
    @Scheduled(fixedDelayString = "${gitops.scheduler.resync-interval-ms:60000}",
               initialDelayString = "${gitops.scheduler.resync-interval-ms:60000}")
    public void resync() {
        int started = 0;
        for (Kustomization unit : store.findAll()) {
            UnitKey key = unit.getKey();
            synchronized (this) {
                if (stopping) {
                    return;
                }
                if (pending.containsKey(key) || inFlight.contains(key) || parked.contains(key)) {
                    continue;
                }
                scheduleAt(key, clock.instant());
                started++;
            }
        }
        if (started > 0) {
            log.info("Resync scheduled {} units without an active loop", started);
        }
    }
    
    /**
     * Stops scheduling new attempts. Running attempts are not interrupted.
     */
    public synchronized void shutdown() {
        stopping = true;
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
        deferred.clear();
        metricsRegistry.setScheduledUnits(0);
        log.info("Reconciliation scheduler stopped ({} attempts in flight)", inFlight.size());
    }
    
    /**
     * Waits until no attempt is in flight.
     *
     * @return true when drained within {@code timeout}
     */
    public synchronized boolean awaitInFlight(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            wait(Math.max(1L, remaining / 1_000_000L));
        }
        return true;
    }
    
    public synchronized boolean isInFlight(UnitKey key) {
        return inFlight.contains(key);
    }
    
    public synchronized boolean isParked(UnitKey key) {
        return parked.contains(key);
    }
    
    public synchronized boolean isScheduled(UnitKey key) {
        return pending.containsKey(key);
    }
    
    public synchronized int inFlightCount() {
        return inFlight.size();
    }
    
    void run(UnitKey key) {
        synchronized (this) {
            pending.remove(key);
            if (stopping) {
                return;
            }
            if (!inFlight.add(key)) {
                deferred.add(key);
                return;
            }
        }
        
        AttemptOutcome outcome = null;
        Optional<Duration> next = null;
        try {
            outcome = attempt(key);
            if (!outcome.isTerminal()) {
                next = nextRun(outcome);
            }
        } finally {
            finish(key, outcome, next);
        }
    }
    
    private AttemptOutcome attempt(UnitKey key) {
        try {
            return reconciler.reconcile(key);
        } catch (RuntimeException e) {
            log.error("Reconciliation of {} failed unexpectedly", key, e);
            return AttemptOutcome.failed(key, ErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }
    
    /**
     * Releases the unit and queues its next attempt. A null {@code outcome} or {@code next} means
     * the attempt ended abnormally; the unit stays unscheduled until the next resync.
     */
    private synchronized void finish(UnitKey key, AttemptOutcome outcome, Optional<Duration> next) {
        inFlight.remove(key);
        notifyAll();
        if (stopping) {
            return;
        }
        if (outcome != null && outcome.isTerminal()) {
            deferred.remove(key);
            parked.remove(key);
            log.debug("Unit {} left the schedule ({})", key, outcome.result());
            metricsRegistry.setScheduledUnits(pending.size());
            return;
        }
        if (deferred.remove(key)) {
            scheduleAt(key, clock.instant());
            return;
        }
        if (next == null) {
            log.warn("Attempt of {} ended abnormally, leaving it to the next resync", key);
            return;
        }
        if (next.isEmpty()) {
            parked.add(key);
            log.info("Unit {} parked", key);
            metricsRegistry.setScheduledUnits(pending.size());
            return;
        }
        scheduleAt(key, clock.instant().plus(next.get()));
        log.debug("Next attempt of {} in {}", key, next.get());
    }
    
    /**
     * Delay before the next attempt, or empty when the loop parks. Reads the store, so it runs
     * outside the scheduler's monitor.
     */
    Optional<Duration> nextRun(AttemptOutcome outcome) {
        if (outcome.result() == AttemptOutcome.Result.SUSPENDED) {
            return Optional.empty();
        }
        Optional<Kustomization> unit = store.find(outcome.key());
        if (unit.isEmpty()) {
            return Optional.empty();
        }
        if (unit.get().getSpec().isSuspend() && !unit.get().isBeingDeleted()) {
            return Optional.empty();
        }
        if (outcome.result() == AttemptOutcome.Result.SUCCEEDED) {
            return Optional.of(unit.get().getSpec().getInterval());
        }
        ErrorCode error = outcome.error();
        if (error != null && error.getRequeuePolicy() == ErrorCode.RequeuePolicy.DEPENDENCY_BACKOFF) {
            return Optional.of(dependencyRequeueInterval);
        }
        return Optional.of(unit.get().getRetryInterval());
    }
    
    private void scheduleAt(UnitKey key, Instant at) {
        ScheduledFuture<?> previous = pending.put(key, taskScheduler.schedule(() -> run(key), at));
        if (previous != null) {
            previous.cancel(false);
        }
        metricsRegistry.setScheduledUnits(pending.size());
    }
}
