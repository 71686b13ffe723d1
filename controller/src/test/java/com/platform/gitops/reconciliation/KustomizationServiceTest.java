package com.platform.gitops.reconciliation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.gitops.config.TypeRegistryConfig;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ResourceNotFoundException;
import com.platform.gitops.error.ValidationException;
import com.platform.gitops.manifest.ManifestParser;
import com.platform.gitops.manifest.TypeRegistry;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.PostBuild;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.observability.StructuredLogger;
import com.platform.gitops.pipeline.VariableSubstitutor;
import com.platform.gitops.status.ConditionStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KustomizationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final UnitKey APPS = UnitKey.of(ReconcilerFixture.NAMESPACE, "apps");

    @Mock
    private ReconciliationScheduler scheduler;

    @Mock
    private ConditionStateMachine stateMachine;

    private final InMemoryKustomizationStore store = new InMemoryKustomizationStore();
    private KustomizationService service;

    @BeforeEach
    void setUp() {
        TypeRegistry typeRegistry = new TypeRegistryConfig()
            .typeRegistry(new ObjectMapper().findAndRegisterModules(), List.of());
        service = new KustomizationService(store, scheduler, stateMachine, new ManifestParser(typeRegistry),
            typeRegistry, new VariableSubstitutor(), new StructuredLogger("gitops-controller-test", "test"),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static KustomizationSpec.KustomizationSpecBuilder spec() {
        return ReconcilerFixture.spec("repo");
    }

    @Test
    @DisplayName("A new unit is stored and scheduled immediately")
    void applyCreates() {
        Kustomization created = service.apply(APPS, spec().build(), "alice");

        assertEquals(1L, created.getGeneration());
        assertTrue(store.find(APPS).isPresent());
        verify(scheduler).trigger(APPS);
    }

    @Test
    void unchangedSpecDoesNotTrigger() {
        service.apply(APPS, spec().build(), "alice");

        Kustomization again = service.apply(APPS, spec().build(), "alice");

        assertEquals(1L, again.getGeneration());
        verify(scheduler, times(1)).trigger(APPS);
    }

    @Test
    void changedSpecBumpsGenerationAndTriggers() {
        service.apply(APPS, spec().build(), "alice");

        Kustomization updated = service.apply(APPS, spec().prune(false).interval(Duration.ofMinutes(1)).build(), "bob");

        assertEquals(2L, updated.getGeneration());
        verify(scheduler, times(2)).trigger(APPS);
    }

    @Test
    void unitBeingDeletedRejectsSpecChanges() {
        service.apply(APPS, spec().build(), "alice");
        service.delete(APPS, "alice");

        ValidationException e = assertThrows(ValidationException.class,
            () -> service.apply(APPS, spec().interval(Duration.ofMinutes(1)).build(), "alice"));
        assertEquals(ErrorCode.RESOURCE_CONFLICT, e.getErrorCode());
    }

    @Test
    void nonPositiveDurationsAreRejected() {
        assertEquals("interval", assertThrows(ValidationException.class,
            () -> service.apply(APPS, spec().interval(Duration.ZERO).build(), "a")).getField());
        assertEquals("retryInterval", assertThrows(ValidationException.class,
            () -> service.apply(APPS, spec().retryInterval(Duration.ofSeconds(-1)).build(), "a")).getField());
        assertEquals("timeout", assertThrows(ValidationException.class,
            () -> service.apply(APPS, spec().timeout(Duration.ZERO).build(), "a")).getField());
        assertTrue(store.findAll().isEmpty());
        verifyNoInteractions(scheduler);
    }

    @Test
    void targetNamespaceLengthIsChecked() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> service.apply(APPS, spec().targetNamespace("x".repeat(64)).build(), "a"));

        assertEquals("targetNamespace", e.getField());
    }

    @Test
    void invalidVariableNameIsRejectedUpFront() {
        KustomizationSpec invalid = spec().postBuild(new PostBuild(Map.of("1BAD", "x"), null)).build();

        ValidationException e = assertThrows(ValidationException.class, () -> service.apply(APPS, invalid, "a"));

        assertEquals("postBuild.substitute", e.getField());
        assertEquals(ErrorCode.INVALID_FIELD_VALUE, e.getErrorCode());
    }

    @Test
    @DisplayName("A YAML manifest without a namespace lands in the default namespace")
    void applyManifest() {
        Kustomization unit = service.applyManifest("""
            apiVersion: kustomize.toolkit.fluxcd.io/v1
            kind: Kustomization
            metadata:
              name: apps
            spec:
              interval: 10m
              prune: true
              sourceRef:
                kind: GitRepository
                name: repo
            """, "alice");

        assertEquals(UnitKey.of("default", "apps"), unit.getKey());
        assertEquals(Duration.ofMinutes(10), unit.getSpec().getInterval());
        assertTrue(unit.getSpec().isPrune());
    }

    @Test
    void manifestOfAnotherKindIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> service.applyManifest("""
            apiVersion: v1
            kind: ConfigMap
            metadata:
              name: apps
            """, "alice"));

        assertEquals(ErrorCode.INVALID_MANIFEST, e.getErrorCode());
    }

    @Test
    void unparseableManifestIsRejected() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> service.applyManifest("- just\n- a list\n", "alice"));

        assertEquals(ErrorCode.INVALID_MANIFEST, e.getErrorCode());
    }

    @Test
    void requestReconcileStampsAndTriggers() {
        service.apply(APPS, spec().build(), "alice");

        Kustomization unit = service.requestReconcile(APPS);

        assertEquals(NOW, unit.getReconcileRequestedAt());
        verify(scheduler, times(2)).trigger(APPS);
    }

    @Test
    @DisplayName("Suspend and resume flip the flag and wake the scheduler")
    void suspendAndResume() {
        service.apply(APPS, spec().build(), "alice");

        assertTrue(service.suspend(APPS, "alice").getSpec().isSuspend());
        Kustomization resumed = service.resume(APPS, "alice");

        assertFalse(resumed.getSpec().isSuspend());
        assertEquals(3L, resumed.getGeneration());
        verify(scheduler, times(3)).trigger(APPS);
    }

    @Test
    void deleteMarksAndTriggers() {
        service.apply(APPS, spec().build(), "alice");

        Kustomization unit = service.delete(APPS, "alice");

        assertEquals(NOW, unit.getDeletionTimestamp());
        assertTrue(store.find(APPS).isPresent());
        verify(scheduler, times(2)).trigger(APPS);
    }

    @Test
    void historyOfUnknownUnitIsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> service.history(APPS));
        verifyNoInteractions(stateMachine);
    }

    @Test
    void listFiltersByNamespace() {
        service.apply(APPS, spec().build(), "alice");
        service.apply(UnitKey.of("team-a", "web"), spec().build(), "alice");

        assertEquals(1, service.list("team-a").size());
        assertEquals(2, service.list(null).size());
    }
}
