package com.platform.gitops.persistence;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ResourceNotFoundException;
import com.platform.gitops.error.ValidationException;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.persistence.entity.KustomizationEntity;
import com.platform.gitops.persistence.repository.KustomizationJpaRepository;
import com.platform.gitops.reconciliation.KustomizationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Kustomization store backed by the {@code kustomizations} table.
 * Every read returns a fresh copy, so callers never share mutable state.
 */
@Slf4j
@Component
public class JpaKustomizationStore implements KustomizationStore {
    
    private static final int MAX_WRITE_ATTEMPTS = 3;
    
    private final KustomizationJpaRepository jpaRepository;
    private final EntityMappers entityMappers;
    private final AtomicLong specRevision = new AtomicLong();
    
    public JpaKustomizationStore(KustomizationJpaRepository jpaRepository, EntityMappers entityMappers) {
        this.jpaRepository = jpaRepository;
        this.entityMappers = entityMappers;
    }
    
    @Override
    public Optional<Kustomization> find(UnitKey key) {
        return jpaRepository.findById(EntityMappers.id(key))
            .map(entityMappers::toDomain);
    }
    
    @Override
    public List<Kustomization> findAll() {
        return jpaRepository.findAllByOrderByNamespaceAscNameAsc().stream()
            .map(entityMappers::toDomain)
            .toList();
    }
    
    @Override
    public Kustomization create(Kustomization kustomization) {
        String id = EntityMappers.id(kustomization.getKey());
        if (jpaRepository.existsById(id)) {
            throw new ValidationException(ErrorCode.RESOURCE_CONFLICT,
                "Kustomization already exists: " + kustomization.getKey());
        }
        Kustomization fresh = kustomization.toBuilder()
            .generation(1L)
            .deletionTimestamp(null)
            .status(KustomizationStatus.initial())
            .build();
        KustomizationEntity saved = jpaRepository.save(entityMappers.toEntity(fresh));
        specRevision.incrementAndGet();
        log.debug("Stored new unit {}", kustomization.getKey());
        return entityMappers.toDomain(saved);
    }
    
    @Override
    public Kustomization updateSpec(UnitKey key, KustomizationSpec spec) {
        String specJson = entityMappers.writeSpec(spec);
        return write(key, entity -> {
            if (specJson.equals(entity.getSpecJson())) {
                return entity;
            }
            entity.setSpecJson(specJson);
            entity.setGeneration(entity.getGeneration() + 1);
            return entity;
        }, true);
    }
    
    @Override
    public void updateStatus(UnitKey key, KustomizationStatus status) {
        String statusJson = entityMappers.writeStatus(status);
        try {
            write(key, entity -> {
                entity.setStatusJson(statusJson);
                return entity;
            }, false);
        } catch (ResourceNotFoundException e) {
            log.debug("Status write for removed unit {} ignored", key);
        }
    }
    
    @Override
    public Kustomization requestReconcile(UnitKey key, Instant requestedAt) {
        return write(key, entity -> {
            entity.setReconcileRequestedAt(requestedAt);
            return entity;
        }, false);
    }
    
    @Override
    public Kustomization markForDeletion(UnitKey key, Instant deletionTimestamp) {
        return write(key, entity -> {
            if (entity.getDeletionTimestamp() == null) {
                entity.setDeletionTimestamp(deletionTimestamp);
            }
            return entity;
        }, true);
    }
    
    @Override
    public void remove(UnitKey key) {
        String id = EntityMappers.id(key);
        if (jpaRepository.existsById(id)) {
            jpaRepository.deleteById(id);
            specRevision.incrementAndGet();
        }
    }
    
    @Override
    public long specRevision() {
        return specRevision.get();
    }
    
    /**
     * Read-modify-write with a bounded retry on concurrent modification.
     */
    private Kustomization write(UnitKey key, Function<KustomizationEntity, KustomizationEntity> change,
                                boolean specChange) {
        String id = EntityMappers.id(key);
        OptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            KustomizationEntity entity = jpaRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.unit(key));
            try {
                KustomizationEntity saved = jpaRepository.save(change.apply(entity));
                if (specChange) {
                    specRevision.incrementAndGet();
                }
                return entityMappers.toDomain(saved);
            } catch (OptimisticLockingFailureException e) {
                lastConflict = e;
                log.debug("Concurrent modification of {} (attempt {}/{})", key, attempt, MAX_WRITE_ATTEMPTS);
            }
        }
        throw lastConflict;
    }
}
