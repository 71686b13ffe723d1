package com.platform.gitops.dependency;

import com.platform.gitops.error.DependencyCycleException;
import com.platform.gitops.error.DependencyNotReadyException;
import com.platform.gitops.model.ConditionReasons;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.reconciliation.KustomizationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Blocks an attempt until every declared dependency is ready.
 * Reads other units' status only; never writes it.
 */
@Slf4j
@Component
public class DependencyGate {
    
    private final KustomizationStore store;
    private final DependencyGraph graph;
    
    public DependencyGate(KustomizationStore store, DependencyGraph graph) {
        this.store = store;
        this.graph = graph;
    }
    
    /**
     * Checks the dependencies of {@code unit} in declaration order.
     *
     * @param revision the source revision about to be built
     * @throws DependencyCycleException when the unit lies on a dependsOn cycle
     * @throws DependencyNotReadyException naming the first dependency that is not ready
     */
    public void check(Kustomization unit, String revision) {
        if (unit.getSpec().getDependsOn().isEmpty()) {
            return;
        }
        graph.findCycle(unit.getKey()).ifPresent(cycle -> {
            throw new DependencyCycleException(cycle);
        });
        
        for (UnitKey key : unit.getDependencyKeys()) {
            Kustomization dependency = store.find(key)
                .orElseThrow(() -> new DependencyNotReadyException(key, "not found"));
            if (dependency.isBeingDeleted()) {
                throw new DependencyNotReadyException(key, "is being deleted");
            }
            if (dependency.getStatus().getObservedGeneration() != dependency.getGeneration()) {
                throw new DependencyNotReadyException(key, String.format(
                    "generation %d not yet observed (observed %d)",
                    dependency.getGeneration(), dependency.getStatus().getObservedGeneration()));
            }
            if (!dependency.getStatus().getConditions().isTrue(ConditionReasons.READY)) {
                throw new DependencyNotReadyException(key, "Ready condition is not True");
            }
            if (Objects.equals(dependency.getResolvedSourceRef(), unit.getResolvedSourceRef())
                    && !Objects.equals(dependency.getStatus().getLastAppliedRevision(), revision)) {
                throw new DependencyNotReadyException(key, String.format(
                    "last applied revision %s does not match %s",
                    dependency.getStatus().getLastAppliedRevision(), revision));
            }
        }
        log.debug("All dependencies of {} are ready", unit.getKey());
    }
}
