package com.platform.gitops.dependency;

import com.platform.gitops.error.DependencyCycleException;
import com.platform.gitops.error.DependencyNotReadyException;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.model.ConditionReasons;
import com.platform.gitops.model.ConditionStatus;
import com.platform.gitops.model.DependencyReference;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.SourceReference;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.reconciliation.KustomizationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DependencyGateTest {

    private static final String REVISION = "main@sha1:1234";

    @Mock
    private KustomizationStore store;

    private DependencyGate gate;

    @BeforeEach
    void setUp() {
        gate = new DependencyGate(store, new DependencyGraph(store));
    }

    private static Kustomization unit(String name, String source, String... dependsOn) {
        return Kustomization.builder()
            .namespace("flux-system")
            .name(name)
            .spec(KustomizationSpec.builder()
                .interval(Duration.ofMinutes(1))
                .sourceRef(new SourceReference("GitRepository", source, null))
                .dependsOn(Arrays.stream(dependsOn).map(d -> new DependencyReference(null, d)).toList())
                .build())
            .build();
    }

    private static Kustomization ready(Kustomization unit, String appliedRevision) {
        KustomizationStatus status = KustomizationStatus.builder()
            .observedGeneration(unit.getGeneration())
            .lastAppliedRevision(appliedRevision)
            .build();
        status.getConditions().upsert(ConditionReasons.READY, ConditionStatus.TRUE,
            ConditionReasons.RECONCILIATION_SUCCEEDED, "", unit.getGeneration(), Instant.now());
        unit.setStatus(status);
        return unit;
    }

    private void stored(Kustomization... units) {
        when(store.findAll()).thenReturn(List.of(units));
        for (Kustomization unit : units) {
            lenient().when(store.find(unit.getKey())).thenReturn(Optional.of(unit));
        }
    }

    @Test
    void unitWithoutDependenciesPasses() {
        assertDoesNotThrow(() -> gate.check(unit("apps", "repo"), REVISION));
        verifyNoInteractions(store);
    }

    @Test
    void readyDependencyPasses() {
        Kustomization infra = ready(unit("infra", "infra-repo"), "other@sha1:9");
        Kustomization apps = unit("apps", "repo", "infra");
        stored(infra, apps);

        assertDoesNotThrow(() -> gate.check(apps, REVISION));
    }

    @Test
    void missingDependencyIsNotReady() {
        Kustomization apps = unit("apps", "repo", "infra");
        stored(apps);
        when(store.find(UnitKey.of("flux-system", "infra"))).thenReturn(Optional.empty());

        DependencyNotReadyException e = assertThrows(DependencyNotReadyException.class, () -> gate.check(apps, REVISION));
        assertTrue(e.getMessage().contains("not found"));
        assertEquals(ErrorCode.DEPENDENCY_NOT_READY, e.getErrorCode());
    }

    @Test
    @DisplayName("Dependency whose latest generation is unobserved is not ready")
    void unobservedGeneration() {
        Kustomization infra = ready(unit("infra", "infra-repo"), "x");
        infra.setGeneration(2);
        Kustomization apps = unit("apps", "repo", "infra");
        stored(infra, apps);

        DependencyNotReadyException e = assertThrows(DependencyNotReadyException.class, () -> gate.check(apps, REVISION));
        assertTrue(e.getMessage().contains("generation 2"));
    }

    @Test
    void dependencyBeingDeletedIsNotReady() {
        Kustomization infra = ready(unit("infra", "infra-repo"), "x");
        infra.setDeletionTimestamp(Instant.now());
        Kustomization apps = unit("apps", "repo", "infra");
        stored(infra, apps);

        assertThrows(DependencyNotReadyException.class, () -> gate.check(apps, REVISION));
    }

    @Test
    @DisplayName("Dependency on the same source must have applied the same revision")
    void sameSourceRevisionMismatch() {
        Kustomization infra = ready(unit("infra", "repo"), "main@sha1:old");
        Kustomization apps = unit("apps", "repo", "infra");
        stored(infra, apps);

        DependencyNotReadyException e = assertThrows(DependencyNotReadyException.class, () -> gate.check(apps, REVISION));
        assertTrue(e.getMessage().contains("main@sha1:old"));

        infra.getStatus().setLastAppliedRevision(REVISION);
        assertDoesNotThrow(() -> gate.check(apps, REVISION));
    }

    @Test
    void cycleIsReported() {
        Kustomization a = unit("a", "repo", "b");
        Kustomization b = unit("b", "repo", "a");
        stored(a, b);

        DependencyCycleException e = assertThrows(DependencyCycleException.class, () -> gate.check(a, REVISION));
        assertEquals(List.of(a.getKey(), b.getKey(), a.getKey()), e.getCycle());
    }
}
