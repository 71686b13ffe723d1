package com.platform.gitops.error;

import com.platform.gitops.model.UnitKey;

/**
 * A declared dependency is missing, being deleted, not ready or behind the expected revision.
 */
public class DependencyNotReadyException extends ReconciliationException {
    
    private final UnitKey dependency;
    
    public DependencyNotReadyException(UnitKey dependency, String detail) {
        super(ErrorCode.DEPENDENCY_NOT_READY,
            String.format("dependency '%s' is not ready: %s", dependency, detail));
        this.dependency = dependency;
    }
    
    public UnitKey getDependency() {
        return dependency;
    }
}
