package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

/**
 * Rolled out: every replica updated and available, no old replicas left, progress deadline not
 * exceeded.
 */
@Component
public class DeploymentReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "Deployment";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        if (!StatusFields.generationObserved(live)) {
            return false;
        }
        if ("False".equals(StatusFields.condition(live, "Progressing"))) {
            return false;
        }
        long desired = StatusFields.desiredReplicas(live);
        return StatusFields.statusCount(live, "updatedReplicas") >= desired
            && StatusFields.statusCount(live, "availableReplicas") >= desired
            && StatusFields.statusCount(live, "replicas") <= desired;
    }
}
