package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

@Component
public class StatefulSetReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "StatefulSet";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        if (!StatusFields.generationObserved(live)) {
            return false;
        }
        long desired = StatusFields.desiredReplicas(live);
        if (StatusFields.statusCount(live, "readyReplicas") < desired) {
            return false;
        }
        String current = live.at("status", "currentRevision").asText("");
        String update = live.at("status", "updateRevision").asText("");
        return current.isEmpty() || update.isEmpty() || current.equals(update);
    }
}
