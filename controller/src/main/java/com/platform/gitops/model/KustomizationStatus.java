package com.platform.gitops.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.gitops.inventory.ResourceInventory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Observed state of a Kustomization, written only by its own reconciliation attempts.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KustomizationStatus {

    public static final long UNOBSERVED_GENERATION = -1L;

    @Builder.Default
    private long observedGeneration = UNOBSERVED_GENERATION;

    @Builder.Default
    private Conditions conditions = new Conditions();

    /**
     * Revision of the last attempt whose apply phase succeeded.
     */
    private String lastAppliedRevision;

    /**
     * Revision of the last attempt, successful or not.
     */
    private String lastAttemptedRevision;

    /**
     * Time of the last manual reconcile request handled.
     */
    private Instant lastHandledReconcileAt;

    /**
     * Objects applied by the last attempt that reached the apply phase.
     * {@code null} when nothing was ever applied.
     */
    private ResourceInventory inventory;

    public static KustomizationStatus initial() {
        return new KustomizationStatus();
    }

    /**
     * Deep copy, so that an attempt can build the next status without touching the stored one.
     */
    public KustomizationStatus copy() {
        return toBuilder().conditions(conditions == null ? new Conditions() : conditions.copy()).build();
    }

    public Conditions getConditions() {
        if (conditions == null) {
            conditions = new Conditions();
        }
        return conditions;
    }
}
