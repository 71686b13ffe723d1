package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

@Component
public class PersistentVolumeClaimReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "PersistentVolumeClaim";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        return "Bound".equals(live.at("status", "phase").asText(""));
    }
}
