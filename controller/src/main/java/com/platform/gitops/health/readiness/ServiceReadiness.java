package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

/**
 * Load balancers are ready once an ingress point is assigned; other service types once they exist.
 */
@Component
public class ServiceReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "Service";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        if (!"LoadBalancer".equals(live.at("spec", "type").asText(""))) {
            return true;
        }
        return live.at("status", "loadBalancer", "ingress").size() > 0;
    }
}
