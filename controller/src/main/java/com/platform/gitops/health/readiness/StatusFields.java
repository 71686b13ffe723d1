package com.platform.gitops.health.readiness;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.gitops.manifest.ManifestObject;

/**
 * Shared reads of the {@code status} stanza.
 */
final class StatusFields {
    
    private StatusFields() {
    }
    
    /**
     * False when the controller of the object has not yet seen its latest generation.
     */
    static boolean generationObserved(ManifestObject live) {
        JsonNode observed = live.at("status", "observedGeneration");
        return observed.isMissingNode() || observed.asLong() >= live.generation();
    }
    
    /**
     * The status of the condition of the given type, or {@code null} when absent.
     */
    static String condition(ManifestObject live, String type) {
        for (JsonNode condition : live.at("status", "conditions")) {
            if (type.equals(condition.path("type").asText())) {
                return condition.path("status").asText();
            }
        }
        return null;
    }
    
    static boolean conditionTrue(ManifestObject live, String type) {
        return "True".equals(condition(live, type));
    }
    
    static long desiredReplicas(ManifestObject live) {
        return live.at("spec", "replicas").asLong(1);
    }
    
    static long statusCount(ManifestObject live, String field) {
        return live.at("status", field).asLong(0);
    }
}
