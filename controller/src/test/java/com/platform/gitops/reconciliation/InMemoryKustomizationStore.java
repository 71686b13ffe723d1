package com.platform.gitops.reconciliation;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ResourceNotFoundException;
import com.platform.gitops.error.ValidationException;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.UnitKey;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map backed store for tests. Hands out copies, like the JPA store.
 */
public class InMemoryKustomizationStore implements KustomizationStore {
    
    private final Map<UnitKey, Kustomization> units = new ConcurrentSkipListMap<>();
    private final AtomicLong specRevision = new AtomicLong();
    private final AtomicInteger statusWrites = new AtomicInteger();
    
    /**
     * Stores {@code unit} as is, status and generation included.
     */
    public void put(Kustomization unit) {
        units.put(unit.getKey(), copy(unit));
        specRevision.incrementAndGet();
    }
    
    public int statusWrites() {
        return statusWrites.get();
    }
    
    @Override
    public Optional<Kustomization> find(UnitKey key) {
        return Optional.ofNullable(units.get(key)).map(InMemoryKustomizationStore::copy);
    }
    
    @Override
    public List<Kustomization> findAll() {
        return units.values().stream().map(InMemoryKustomizationStore::copy).toList();
    }
    
    @Override
    public synchronized Kustomization create(Kustomization kustomization) {
        if (units.containsKey(kustomization.getKey())) {
            throw new ValidationException(ErrorCode.RESOURCE_CONFLICT, "exists: " + kustomization.getKey());
        }
        Kustomization fresh = kustomization.toBuilder()
            .generation(1L)
            .status(KustomizationStatus.initial())
            .build();
        put(fresh);
        return copy(fresh);
    }
    
    @Override
    public synchronized Kustomization updateSpec(UnitKey key, KustomizationSpec spec) {
        Kustomization existing = require(key);
        if (!existing.getSpec().equals(spec)) {
            existing.setSpec(spec.toBuilder().build());
            existing.setGeneration(existing.getGeneration() + 1);
            specRevision.incrementAndGet();
        }
        return copy(existing);
    }
    
    @Override
    public synchronized void updateStatus(UnitKey key, KustomizationStatus status) {
        Kustomization existing = units.get(key);
        if (existing != null) {
            existing.setStatus(status.copy());
            statusWrites.incrementAndGet();
        }
    }
    
    @Override
    public synchronized Kustomization requestReconcile(UnitKey key, Instant requestedAt) {
        Kustomization existing = require(key);
        existing.setReconcileRequestedAt(requestedAt);
        return copy(existing);
    }
    
    @Override
    public synchronized Kustomization markForDeletion(UnitKey key, Instant deletionTimestamp) {
        Kustomization existing = require(key);
        if (existing.getDeletionTimestamp() == null) {
            existing.setDeletionTimestamp(deletionTimestamp);
            specRevision.incrementAndGet();
        }
        return copy(existing);
    }
    
    @Override
    public synchronized void remove(UnitKey key) {
        if (units.remove(key) != null) {
            specRevision.incrementAndGet();
        }
    }
    
    @Override
    public long specRevision() {
        return specRevision.get();
    }
    
    private Kustomization require(UnitKey key) {
        Kustomization existing = units.get(key);
        if (existing == null) {
            throw ResourceNotFoundException.unit(key);
        }
        return existing;
    }
    
    private static Kustomization copy(Kustomization unit) {
        return unit.toBuilder()
            .spec(unit.getSpec() == null ? null : unit.getSpec().toBuilder().build())
            .status(unit.getStatus() == null ? KustomizationStatus.initial() : unit.getStatus().copy())
            .build();
    }
}
