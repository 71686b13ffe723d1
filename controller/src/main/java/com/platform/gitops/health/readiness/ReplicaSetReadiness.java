package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

@Component
public class ReplicaSetReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "ReplicaSet";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        long desired = StatusFields.desiredReplicas(live);
        return StatusFields.generationObserved(live)
            && StatusFields.statusCount(live, "readyReplicas") >= desired
            && StatusFields.statusCount(live, "availableReplicas") >= desired;
    }
}
