package com.platform.gitops.status;

import com.platform.gitops.model.Condition;
import com.platform.gitops.model.ConditionReasons;
import com.platform.gitops.model.ConditionStatus;
import com.platform.gitops.model.Conditions;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies the Ready/Healthy transitions of a unit to a working copy of its status.
 * Every change is validated against the set of legal reasons, logged, counted and kept in a
 * bounded in-memory history per unit.
 *
 * <p>Conditions are stamped with the generation of the {@link Kustomization} snapshot passed in,
 * which is the one read when the attempt started.
 */
@Slf4j
@Component
public class ConditionStateMachine {
    
    public static final String TRUNCATION_MARKER = "...";
    
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final int historySize;
    private final Map<UnitKey, Deque<ConditionTransition>> history = new ConcurrentHashMap<>();
    
    public ConditionStateMachine(MetricsRegistry metricsRegistry, Clock clock,
                                 @Value("${gitops.status.history-size:50}") int historySize) {
        this.metricsRegistry = metricsRegistry;
        this.clock = clock;
        this.historySize = historySize;
    }
    
    /**
     * Reconciliation start: Ready=Unknown. Healthy is left alone.
     */
    public void progressing(Kustomization unit, KustomizationStatus status, String message) {
        set(unit, status, ConditionReasons.READY, ConditionStatus.UNKNOWN, ConditionReasons.PROGRESSING, message);
    }
    
    /**
     * Any failed phase: Ready=False with the phase reason. Healthy is left alone.
     */
    public void failed(Kustomization unit, KustomizationStatus status, String reason, String message) {
        if (reason == null || ConditionReasons.RECONCILIATION_SUCCEEDED.equals(reason)
                || ConditionReasons.PROGRESSING.equals(reason)) {
            throw new IllegalArgumentException("not a failure reason: " + reason);
        }
        set(unit, status, ConditionReasons.READY, ConditionStatus.FALSE, reason, message);
    }
    
    /**
     * Apply phase succeeded: Ready=True, and the revision becomes the last applied one.
     */
    public void succeeded(Kustomization unit, KustomizationStatus status, String revision, String message) {
        set(unit, status, ConditionReasons.READY, ConditionStatus.TRUE,
            ConditionReasons.RECONCILIATION_SUCCEEDED, message);
        status.setLastAppliedRevision(revision);
    }
    
    public void healthy(Kustomization unit, KustomizationStatus status, String message) {
        set(unit, status, ConditionReasons.HEALTHY, ConditionStatus.TRUE,
            ConditionReasons.RECONCILIATION_SUCCEEDED, message);
    }
    
    public void unhealthy(Kustomization unit, KustomizationStatus status, String message) {
        set(unit, status, ConditionReasons.HEALTHY, ConditionStatus.FALSE, ConditionReasons.UNHEALTHY, message);
    }
    
    /**
     * Keeps the Healthy condition present exactly when the unit asks for a health assessment.
     * A required but absent condition starts as Unknown/Progressing.
     */
    public void normalizeHealth(Kustomization unit, KustomizationStatus status) {
        Conditions conditions = status.getConditions();
        if (!unit.isHealthCheckRequired()) {
            conditions.remove(ConditionReasons.HEALTHY).ifPresent(removed ->
                record(unit, ConditionReasons.HEALTHY, removed.status(), null, "HealthCheckRemoved",
                    "health assessment no longer requested"));
            return;
        }
        if (!conditions.has(ConditionReasons.HEALTHY)) {
            set(unit, status, ConditionReasons.HEALTHY, ConditionStatus.UNKNOWN, ConditionReasons.PROGRESSING,
                "health assessment pending");
        }
    }
    
    /**
     * Closes an attempt: stamps the observed generation (never lowering it) and the attempted
     * revision, then normalizes Healthy.
     */
    public void completeAttempt(Kustomization unit, KustomizationStatus status, String revision) {
        status.setObservedGeneration(Math.max(status.getObservedGeneration(), unit.getGeneration()));
        if (revision != null) {
            status.setLastAttemptedRevision(revision);
        }
        normalizeHealth(unit, status);
    }
    
    public List<ConditionTransition> history(UnitKey key) {
        Deque<ConditionTransition> transitions = history.get(key);
        if (transitions == null) {
            return List.of();
        }
        synchronized (transitions) {
            return new ArrayList<>(transitions);
        }
    }
    
    public void forget(UnitKey key) {
        history.remove(key);
    }
    
    /**
     * Bounds a condition message to {@link Kustomization#MAX_CONDITION_MESSAGE_LENGTH} characters
     * plus the truncation marker.
     */
    public static String truncate(String message) {
        if (message == null) {
            return "";
        }
        if (message.length() <= Kustomization.MAX_CONDITION_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, Kustomization.MAX_CONDITION_MESSAGE_LENGTH) + TRUNCATION_MARKER;
    }
    
    private void set(Kustomization unit, KustomizationStatus status, String type, ConditionStatus target,
                     String reason, String message) {
        Conditions conditions = status.getConditions();
        Optional<Condition> previous = conditions.get(type);
        String stored = truncate(message);
        conditions.upsert(type, target, reason, stored, unit.getGeneration(), clock.instant());
        
        boolean changed = previous
            .map(p -> p.status() != target || !p.reason().equals(reason))
            .orElse(true);
        if (changed) {
            record(unit, type, previous.map(Condition::status).orElse(null), target, reason, stored);
        }
    }
    
    private void record(Kustomization unit, String type, ConditionStatus from, ConditionStatus to,
                        String reason, String message) {
        String key = unit.getKey().toString();
        log.info("Condition transition: {} {} -> {} for {} (reason: {})", type, from, to, key, reason);
        metricsRegistry.recordConditionTransition(key, type, from, to, reason);
        
        ConditionTransition transition = new ConditionTransition(key, type, from, to, reason, message,
            unit.getGeneration(), clock.instant());
        Deque<ConditionTransition> transitions = history.computeIfAbsent(unit.getKey(), k -> new ArrayDeque<>());
        synchronized (transitions) {
            transitions.addLast(transition);
            while (transitions.size() > historySize) {
                transitions.removeFirst();
            }
        }
    }
}
