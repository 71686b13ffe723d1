package com.platform.gitops.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of conditions keyed by type.
 * Upserting a condition replaces the entry of the same type in place and keeps the previous
 * transition time when the status value does not change.
 */
public class Conditions {

    private final Map<String, Condition> byType = new LinkedHashMap<>();

    public Conditions() {
    }

    @JsonCreator
    public Conditions(List<Condition> conditions) {
        if (conditions != null) {
            conditions.forEach(c -> byType.put(c.type(), c));
        }
    }

    public Conditions copy() {
        return new Conditions(asList());
    }

    /**
     * Insert or replace the condition of the given type.
     *
     * @return the stored condition
     */
    public Condition upsert(String type, ConditionStatus status, String reason, String message,
                            long observedGeneration, Instant now) {
        Condition existing = byType.get(type);
        Instant transitionTime = existing != null && existing.status() == status
            ? existing.lastTransitionTime()
            : now;
        Condition updated = new Condition(type, status, reason, message, observedGeneration, transitionTime);
        byType.put(type, updated);
        return updated;
    }

    public Optional<Condition> remove(String type) {
        return Optional.ofNullable(byType.remove(type));
    }

    public Optional<Condition> get(String type) {
        return Optional.ofNullable(byType.get(type));
    }

    public boolean has(String type) {
        return byType.containsKey(type);
    }

    public boolean isTrue(String type) {
        return get(type).map(Condition::isTrue).orElse(false);
    }

    public int size() {
        return byType.size();
    }

    @JsonValue
    public List<Condition> asList() {
        return new ArrayList<>(byType.values());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Conditions other && byType.equals(other.byType);
    }

    @Override
    public int hashCode() {
        return byType.hashCode();
    }

    @Override
    public String toString() {
        return byType.values().toString();
    }
}
