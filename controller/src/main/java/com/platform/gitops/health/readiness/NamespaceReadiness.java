package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

/**
 * Ready unless terminating.
 */
@Component
public class NamespaceReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "Namespace";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        return !"Terminating".equals(live.at("status", "phase").asText(""));
    }
}
