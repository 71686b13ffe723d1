package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

@Component
public class PodReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "Pod";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        String phase = live.at("status", "phase").asText("");
        if ("Succeeded".equals(phase)) {
            return true;
        }
        return "Running".equals(phase) && StatusFields.conditionTrue(live, "Ready");
    }
}
