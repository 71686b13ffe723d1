package com.platform.gitops.health.readiness;

import com.platform.gitops.manifest.ManifestObject;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lookup table from kind to {@link ReadinessChecker}, with {@link ConditionReadiness} for every
 * other kind.
 */
@Component
public class ReadinessRegistry {
    
    private final Map<String, ReadinessChecker> byKind;
    private final ReadinessChecker fallback = new ConditionReadiness();
    
    public ReadinessRegistry(List<ReadinessChecker> checkers) {
        this.byKind = checkers.stream()
            .collect(Collectors.toMap(
                ReadinessChecker::getKind,
                Function.identity()
            ));
    }
    
    /**
     * A registry holding every built-in checker.
     */
    public static ReadinessRegistry defaults() {
        return new ReadinessRegistry(List.of(
            new DeploymentReadiness(),
            new StatefulSetReadiness(),
            new DaemonSetReadiness(),
            new ReplicaSetReadiness(),
            new JobReadiness(),
            new PodReadiness(),
            new PersistentVolumeClaimReadiness(),
            new ServiceReadiness(),
            new CustomResourceDefinitionReadiness(),
            new NamespaceReadiness()
        ));
    }
    
    public ReadinessChecker forKind(String kind) {
        return byKind.getOrDefault(kind, fallback);
    }
    
    public boolean isReady(ManifestObject live) {
        return forKind(live.kind()).isReady(live);
    }
}
