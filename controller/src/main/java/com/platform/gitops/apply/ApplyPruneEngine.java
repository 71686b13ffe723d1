package com.platform.gitops.apply;

import com.platform.gitops.cluster.AppliedObject;
import com.platform.gitops.cluster.ApplyAction;
import com.platform.gitops.cluster.ClusterClient;
import com.platform.gitops.cluster.ClusterCredential;
import com.platform.gitops.cluster.ImmutableFieldException;
import com.platform.gitops.cluster.ObjectNotFoundException;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.error.ReconciliationTimeoutException;
import com.platform.gitops.inventory.InvalidInventoryException;
import com.platform.gitops.inventory.ResourceInventory;
import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.ObjectIdentifier;
import com.platform.gitops.observability.MetricsRegistry;
import com.platform.gitops.observability.StructuredLogger;
import com.platform.gitops.reconciliation.AttemptProgress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a render to the cluster and garbage collects what the previous inventory holds but
 * the render no longer does.
 *
 * <p>Apply is best effort: a failing object is reported and left out of the new inventory while
 * the remaining objects are still applied.
 */
@Slf4j
@Component
public class ApplyPruneEngine {
    
    public static final String NAME_LABEL = "gitops.platform.com/name";
    public static final String NAMESPACE_LABEL = "gitops.platform.com/namespace";
    public static final String PRUNE_ANNOTATION = "gitops.platform.com/prune";
    public static final String DISABLED = "disabled";
    
    private final ClusterClient clusterClient;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    private record ApplyOutcome(AppliedObject applied, String error) {
    }
    
    private record PruneOutcome(List<ObjectIdentifier> pruned, List<ObjectIdentifier> skipped,
                                List<String> errors, List<ChangeSetEntry> changes) {
        PruneOutcome() {
            this(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        }
    }
    
    public ApplyPruneEngine(ClusterClient clusterClient, MetricsRegistry metricsRegistry,
                            StructuredLogger structuredLogger) {
        this.clusterClient = clusterClient;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    /**
     * Owner labels stamped on every applied object.
     */
    public static Map<String, String> ownerLabels(Kustomization unit) {
        return Map.of(NAME_LABEL, unit.getName(), NAMESPACE_LABEL, unit.getNamespace());
    }
    
    /**
     * Applies {@code objects} and, when the unit prunes, deletes stale entries of its current
     * inventory. The new inventory is handed to {@code progress} as soon as the apply loop ends.
     *
     * @throws ReconciliationException with APPLY_FAILED when an inventory is malformed
     * @throws ReconciliationTimeoutException when the deadline passes between cluster calls
     */
    public ApplyResult reconcile(Kustomization unit, List<ManifestObject> objects, ClusterCredential credential,
                                 Deadline deadline, AttemptProgress progress) {
        ResourceInventory previous = unit.getStatus().getInventory();
        validate(previous, "previous");
        String unitKey = unit.getKey().toString();
        
        List<ManifestObject> ordered = new ArrayList<>(objects);
        ordered.sort(ApplyOrder.COMPARATOR);
        Map<String, String> labels = ownerLabels(unit);
        
        List<ObjectIdentifier> applied = new ArrayList<>();
        List<ChangeSetEntry> changeSet = new ArrayList<>();
        List<String> applyErrors = new ArrayList<>();
        for (ManifestObject object : ordered) {
            deadline.check(ErrorCode.APPLY_FAILED, "applying " + object.identifier().displayName());
            labels.forEach(object::setLabel);
            ApplyOutcome outcome = applyOne(object, credential, unit.getSpec().isForce(), deadline);
            if (outcome.error() != null) {
                applyErrors.add(outcome.error());
                continue;
            }
            AppliedObject result = outcome.applied();
            applied.add(result.id());
            if (result.action().isMutation()) {
                changeSet.add(new ChangeSetEntry(result.id(), result.action().describe()));
                structuredLogger.reconcile().objectApplied(result.id().displayName(), result.action().describe());
            }
            metricsRegistry.recordApplied(unitKey, result.action().describe(), 1);
        }
        ResourceInventory inventory = ResourceInventory.of(applied);
        validate(inventory, "new");
        progress.applied(inventory);
        
        PruneOutcome prune = new PruneOutcome();
        if (unit.getSpec().isPrune()) {
            progress.enter(ErrorCode.PRUNE_FAILED);
            Set<String> rendered = new HashSet<>();
            ordered.forEach(o -> rendered.add(o.identifier().inventoryId()));
            List<ObjectIdentifier> stale = previous != null
                ? previous.staleAgainst(ordered.stream().map(ManifestObject::identifier).toList())
                : discoverOwned(unit, rendered, credential);
            deleteAll(stale, credential, deadline, prune);
            changeSet.addAll(prune.changes());
            metricsRegistry.recordPruned(unitKey, prune.pruned().size());
        }
        
        log.info("Applied {} objects for {} ({} failed, {} pruned, {} skipped)",
            applied.size(), unitKey, applyErrors.size(), prune.pruned().size(), prune.skipped().size());
        return new ApplyResult(inventory, changeSet, applyErrors, prune.errors(), prune.pruned(), prune.skipped());
    }
    
    /**
     * Deletes every object of {@code inventory} in reverse order. Used when a unit is removed.
     * The returned inventory holds the entries that are still live.
     */
    public ApplyResult deleteInventory(ResourceInventory inventory, ClusterCredential credential, Deadline deadline) {
        validate(inventory, "current");
        List<ObjectIdentifier> reversed = new ArrayList<>(inventory.entries());
        Collections.reverse(reversed);
        PruneOutcome prune = new PruneOutcome();
        deleteAll(reversed, credential, deadline, prune);
        
        List<ObjectIdentifier> remaining = new ArrayList<>(inventory.entries());
        remaining.removeAll(prune.pruned());
        remaining.removeAll(prune.skipped());
        return new ApplyResult(ResourceInventory.of(remaining), prune.changes(), List.of(), prune.errors(),
            prune.pruned(), prune.skipped());
    }
    
    private ApplyOutcome applyOne(ManifestObject object, ClusterCredential credential, boolean force,
                                  Deadline deadline) {
        ObjectIdentifier id = object.identifier();
        try {
            return new ApplyOutcome(clusterClient.apply(object, credential), null);
        } catch (ImmutableFieldException e) {
            if (!force) {
                return failed(id, e);
            }
            return recreate(object, credential, deadline);
        } catch (ReconciliationTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            return failed(id, e);
        }
    }
    
    private ApplyOutcome recreate(ManifestObject object, ClusterCredential credential, Deadline deadline) {
        ObjectIdentifier id = object.identifier();
        log.info("Recreating {} after immutable field conflict", id);
        deadline.check(ErrorCode.APPLY_FAILED, "recreating " + id.displayName());
        try {
            try {
                clusterClient.delete(id, credential);
            } catch (ObjectNotFoundException gone) {
                log.debug("{} disappeared before recreate", id);
            }
            clusterClient.apply(object, credential);
            return new ApplyOutcome(new AppliedObject(id, ApplyAction.RECREATED), null);
        } catch (RuntimeException e) {
            return failed(id, e);
        }
    }
    
    private static ApplyOutcome failed(ObjectIdentifier id, RuntimeException e) {
        log.warn("Failed to apply {}: {}", id, e.getMessage());
        return new ApplyOutcome(null, id.displayName() + ": " + e.getMessage());
    }
    
    /**
     * Stale candidates when the unit has no recorded inventory: objects carrying its owner
     * labels that the render does not contain.
     */
    private List<ObjectIdentifier> discoverOwned(Kustomization unit, Set<String> rendered, ClusterCredential credential) {
        List<ManifestObject> owned = new ArrayList<>(clusterClient.listByLabels(ownerLabels(unit), credential));
        owned.sort(ApplyOrder.COMPARATOR.reversed());
        List<ObjectIdentifier> stale = owned.stream()
            .map(ManifestObject::identifier)
            .filter(id -> !rendered.contains(id.inventoryId()))
            .toList();
        if (!stale.isEmpty()) {
            log.info("No inventory recorded for {}, found {} owned objects missing from the render", unit.getKey(), stale.size());
        }
        return stale;
    }
    
    private void deleteAll(List<ObjectIdentifier> stale, ClusterCredential credential, Deadline deadline,
                           PruneOutcome outcome) {
        for (ObjectIdentifier id : stale) {
            deadline.check(ErrorCode.PRUNE_FAILED, "deleting " + id.displayName());
            try {
                Optional<ManifestObject> live = clusterClient.get(id, credential);
                if (live.isEmpty()) {
                    outcome.pruned().add(id);
                    continue;
                }
                if (DISABLED.equals(live.get().annotation(PRUNE_ANNOTATION))) {
                    log.info("Skipping prune of {}: pruning disabled on the object", id);
                    outcome.skipped().add(id);
                    continue;
                }
                clusterClient.delete(id, credential);
                outcome.pruned().add(id);
                outcome.changes().add(new ChangeSetEntry(id, "deleted"));
                structuredLogger.reconcile().objectPruned(id.displayName());
            } catch (ObjectNotFoundException e) {
                outcome.pruned().add(id);
            } catch (ReconciliationTimeoutException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Failed to delete {}: {}", id, e.getMessage());
                outcome.errors().add(id.displayName() + ": " + e.getMessage());
            }
        }
    }
    
    private static void validate(ResourceInventory inventory, String which) {
        if (inventory == null) {
            return;
        }
        try {
            inventory.validate();
        } catch (InvalidInventoryException e) {
            throw new ReconciliationException(ErrorCode.APPLY_FAILED,
                String.format("%s inventory is invalid: %s", which, e.getMessage()), e);
        }
    }
}
