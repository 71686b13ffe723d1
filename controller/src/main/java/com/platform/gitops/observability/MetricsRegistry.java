package com.platform.gitops.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for all controller metrics.
 * Records attempt outcomes, phase durations, object mutations and condition transitions.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger scheduledUnits = new AtomicInteger();
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        
        initializeMetrics();
    }
    
    private void initializeMetrics() {
        Gauge.builder("gitops.reconcile.inflight", inFlight, AtomicInteger::get)
            .description("Attempts currently running")
            .register(meterRegistry);
        Gauge.builder("gitops.units.scheduled", scheduledUnits, AtomicInteger::get)
            .description("Units with an active reconcile loop")
            .register(meterRegistry);
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record the outcome of one attempt. {@code reason} is the Ready reason written.
     */
    public void recordAttempt(String unit, String reason, boolean success, Duration duration) {
        incrementCounter("gitops.reconcile.attempts", "unit", unit, "reason", reason,
            "success", String.valueOf(success));
        String timerKey = "attempt." + unit;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("gitops.reconcile.duration")
                .tag("unit", unit)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(duration);
    }
    
    /**
     * Record how long one phase of an attempt took.
     */
    public void recordPhase(String phase, Duration duration) {
        Timer timer = timers.computeIfAbsent("phase." + phase, k ->
            Timer.builder("gitops.reconcile.phase.duration")
                .tag("phase", phase)
                .register(meterRegistry));
        timer.record(duration);
    }
    
    public void recordApplied(String unit, String action, int count) {
        if (count > 0) {
            counter("gitops.objects.applied", "unit", unit, "action", action).increment(count);
        }
    }
    
    public void recordPruned(String unit, int count) {
        if (count > 0) {
            counter("gitops.objects.pruned", "unit", unit).increment(count);
        }
    }
    
    /**
     * Record a condition transition.
     */
    public void recordConditionTransition(String unit, String type, Object fromStatus, Object toStatus, String reason) {
        String from = fromStatus != null ? fromStatus.toString() : "null";
        String to = toStatus != null ? toStatus.toString() : "unknown";
        
        incrementCounter("gitops.condition.transition",
            "unit", unit,
            "type", type,
            "from", from,
            "to", to,
            "reason", reason);
        
        log.debug("Recorded condition transition for {}: {} {} -> {}", unit, type, from, to);
    }
    
    public void recordDependencyCycle(String unit) {
        incrementCounter("gitops.dependency.cycle", "unit", unit);
    }
    
    public void recordDeferredTrigger(String unit) {
        incrementCounter("gitops.reconcile.deferred", "unit", unit);
    }
    
    public void attemptStarted() {
        inFlight.incrementAndGet();
    }
    
    public void attemptFinished() {
        inFlight.decrementAndGet();
    }
    
    public void setScheduledUnits(int count) {
        scheduledUnits.set(count);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        counter(name, tags).increment();
    }
    
    private Counter counter(String name, String... tags) {
        String key = name + String.join(".", tags);
        return counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry));
    }
}
