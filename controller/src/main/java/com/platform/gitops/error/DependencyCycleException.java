package com.platform.gitops.error;

import com.platform.gitops.model.UnitKey;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The unit takes part in a dependsOn cycle.
 */
public class DependencyCycleException extends ReconciliationException {
    
    private final List<UnitKey> cycle;
    
    public DependencyCycleException(List<UnitKey> cycle) {
        super(ErrorCode.DEPENDENCY_CYCLE,
            "circular dependency detected: " + cycle.stream().map(UnitKey::toString).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }
    
    public List<UnitKey> getCycle() {
        return cycle;
    }
}
