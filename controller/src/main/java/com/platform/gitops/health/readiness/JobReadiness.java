package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

/**
 * Ready once completed; a failed job never becomes ready.
 */
@Component
public class JobReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "Job";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        return !StatusFields.conditionTrue(live, "Failed") && StatusFields.conditionTrue(live, "Complete");
    }
}
