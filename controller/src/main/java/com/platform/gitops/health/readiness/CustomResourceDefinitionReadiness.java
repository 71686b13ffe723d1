package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

@Component
public class CustomResourceDefinitionReadiness implements ReadinessChecker {
    
    @Override
    public String getKind() {
        return "CustomResourceDefinition";
    }
    
    @Override
    public boolean isReady(ManifestObject live) {
        return StatusFields.conditionTrue(live, "Established")
            && !"False".equals(StatusFields.condition(live, "NamesAccepted"));
    }
}
