package com.platform.gitops.health;

import com.platform.gitops.apply.Deadline;
import com.platform.gitops.cluster.ClusterClient;
import com.platform.gitops.cluster.ClusterCredential;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationTimeoutException;
import com.platform.gitops.health.readiness.ReadinessRegistry;
import com.platform.gitops.inventory.ResourceInventory;
import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.model.DurationFormat;
import com.platform.gitops.model.HealthCheckReference;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.ObjectIdentifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Polls the live state of tracked objects until all of them are ready or the attempt deadline
 * passes.
 */
@Slf4j
@Component
public class HealthAssessor {
    
    private final ClusterClient clusterClient;
    private final ReadinessRegistry readinessRegistry;
    private final Clock clock;
    private final Duration pollInterval;
    private final int maxReported;
    
    public HealthAssessor(ClusterClient clusterClient,
                          ReadinessRegistry readinessRegistry,
                          Clock clock,
                          @Value("${gitops.health.poll-interval:5s}") Duration pollInterval,
                          @Value("${gitops.health.max-reported:5}") int maxReported) {
        this.clusterClient = clusterClient;
        this.readinessRegistry = readinessRegistry;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.maxReported = maxReported;
    }
    
    /**
     * Objects whose health the unit asks for: every applied object with {@code wait}, else the
     * explicit health checks, else none.
     */
    public List<ObjectIdentifier> trackedObjects(Kustomization unit, ResourceInventory applied) {
        if (unit.getSpec().isWait()) {
            return applied.entries();
        }
        List<ObjectIdentifier> tracked = new ArrayList<>();
        for (HealthCheckReference check : unit.getSpec().getHealthChecks()) {
            tracked.add(check.toIdentifier(unit.getNamespace()));
        }
        return tracked;
    }
    
    /**
     * @throws ReconciliationTimeoutException with UNHEALTHY when the attempt is interrupted
     */
    public HealthResult assess(List<ObjectIdentifier> tracked, ClusterCredential credential, Deadline deadline) {
        Instant start = clock.instant();
        Set<ObjectIdentifier> pending = new LinkedHashSet<>(tracked);
        while (true) {
            pending.removeIf(id -> isReady(id, credential));
            Duration elapsed = Duration.between(start, clock.instant());
            if (pending.isEmpty()) {
                log.debug("{} tracked objects ready after {}", tracked.size(), elapsed);
                return new HealthResult(true, List.of(), elapsed,
                    String.format("Health check passed in %s", DurationFormat.format(elapsed)));
            }
            if (deadline.isExpired()) {
                List<ObjectIdentifier> notReady = pending.stream().sorted(ObjectIdentifier.DIAGNOSTIC_ORDER).toList();
                return new HealthResult(false, notReady, elapsed, failureMessage(notReady, elapsed));
            }
            sleep(min(pollInterval, deadline.remaining()), deadline);
        }
    }
    
    private boolean isReady(ObjectIdentifier id, ClusterCredential credential) {
        Optional<ManifestObject> live = clusterClient.get(id, credential);
        return live.isPresent() && readinessRegistry.isReady(live.get());
    }
    
    private String failureMessage(List<ObjectIdentifier> notReady, Duration elapsed) {
        String listed = notReady.stream()
            .limit(maxReported)
            .map(ObjectIdentifier::displayName)
            .collect(Collectors.joining(", "));
        int more = notReady.size() - Math.min(maxReported, notReady.size());
        return String.format("Health check failed after %s, timeout waiting for: [%s]%s",
            DurationFormat.format(elapsed), listed, more > 0 ? " and " + more + " more" : "");
    }
    
    private static void sleep(Duration duration, Deadline deadline) {
        try {
            Thread.sleep(Math.max(1L, duration.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReconciliationTimeoutException(ErrorCode.UNHEALTHY, deadline.timeout(),
                "interrupted while waiting for health checks");
        }
    }
    
    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
