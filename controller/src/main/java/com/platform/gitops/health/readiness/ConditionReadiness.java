package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;

/**
 * Fallback for kinds without a dedicated checker: the Ready condition decides when the object
 * publishes one, otherwise an existing object whose generation was observed is ready.
 */
public class ConditionReadiness implements ReadinessChecker {
    
    public static final String ANY_KIND = "*";
    
    @Override
    public String getKind() {
        return ANY_KIND;
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        if (!StatusFields.generationObserved(live)) {
            return false;
        }
        String ready = StatusFields.condition(live, "Ready");
        return ready == null || "True".equals(ready);
    }
}
