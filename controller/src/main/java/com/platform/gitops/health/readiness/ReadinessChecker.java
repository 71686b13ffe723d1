package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;

/**
 * Readiness of one kind of cluster object, judged from its live state.
 */
public interface ReadinessChecker {
    
    /**
     * The kind this checker handles.
     */
    String getKind();
    
    boolean isReady(ManifestObject live);
}
