package com.platform.gitops.reconciliation;

import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.UnitKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store of Kustomization units.
 * Spec writes come from users; status writes only from the unit's own attempts.
 */
public interface KustomizationStore {
    
    Optional<Kustomization> find(UnitKey key);
    
    List<Kustomization> findAll();
    
    /**
     * Stores a new unit at generation 1 with an initial status.
     *
     * @throws com.platform.gitops.error.ValidationException when the unit already exists
     */
    Kustomization create(Kustomization kustomization);
    
    /**
     * Replaces the spec. The generation is bumped only when the value changes.
     *
     * @throws com.platform.gitops.error.ResourceNotFoundException when the unit does not exist
     */
    Kustomization updateSpec(UnitKey key, KustomizationSpec spec);
    
    /**
     * Replaces the status. A unit removed in the meantime is ignored.
     */
    void updateStatus(UnitKey key, KustomizationStatus status);
    
    Kustomization requestReconcile(UnitKey key, Instant requestedAt);
    
    /**
     * Sets the deletion timestamp; the unit stays until its finalizing pass removes it.
     */
    Kustomization markForDeletion(UnitKey key, Instant deletionTimestamp);
    
    void remove(UnitKey key);
    
    /**
     * Counter bumped on every change to any unit's spec or to the set of units.
     */
    long specRevision();
}
