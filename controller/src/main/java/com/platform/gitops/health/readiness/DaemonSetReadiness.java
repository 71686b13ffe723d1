package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

@Component
public class DaemonSetReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "DaemonSet";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        if (!StatusFields.generationObserved(live) || live.at("status", "desiredNumberScheduled").isMissingNode()) {
            return false;
        }
        long desired = StatusFields.statusCount(live, "desiredNumberScheduled");
        return StatusFields.statusCount(live, "updatedNumberScheduled") >= desired
            && StatusFields.statusCount(live, "numberAvailable") >= desired
            && StatusFields.statusCount(live, "numberReady") >= desired;
    }
}
