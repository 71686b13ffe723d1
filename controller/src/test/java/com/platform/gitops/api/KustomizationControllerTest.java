package com.platform.gitops.api;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ResourceNotFoundException;
import com.platform.gitops.error.ValidationException;
import com.platform.gitops.model.ConditionStatus;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.SourceReference;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.observability.MetricsRegistry;
import com.platform.gitops.reconciliation.KustomizationService;
import com.platform.gitops.status.ConditionTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(KustomizationController.class)
class KustomizationControllerTest {

    private static final UnitKey APPS = UnitKey.of("flux-system", "apps");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private KustomizationService kustomizationService;

    @MockBean
    private MetricsRegistry metricsRegistry;

    private static Kustomization apps() {
        return Kustomization.builder()
            .namespace(APPS.namespace())
            .name(APPS.name())
            .spec(KustomizationSpec.builder()
                .interval(Duration.ofMinutes(5))
                .sourceRef(new SourceReference("GitRepository", "repo", null))
                .build())
            .build();
    }

    @Test
    void getReturnsTheUnit() throws Exception {
        when(kustomizationService.get(APPS)).thenReturn(apps());

        mockMvc.perform(get("/api/kustomizations/flux-system/apps"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("apps"))
            .andExpect(jsonPath("$.generation").value(1))
            .andExpect(jsonPath("$.spec.interval").value("5m"))
            .andExpect(jsonPath("$.spec.sourceRef.kind").value("GitRepository"));
    }

    @Test
    void unknownUnitIsNotFound() throws Exception {
        when(kustomizationService.get(APPS)).thenThrow(ResourceNotFoundException.unit(APPS));

        mockMvc.perform(get("/api/kustomizations/flux-system/apps"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("GO-301"))
            .andExpect(jsonPath("$.path").value("/api/kustomizations/flux-system/apps"))
            .andExpect(jsonPath("$.metadata.resourceType").value("Kustomization"));
    }

    @Test
    void listFiltersByNamespace() throws Exception {
        when(kustomizationService.list("flux-system")).thenReturn(List.of(apps()));

        mockMvc.perform(get("/api/kustomizations").param("namespace", "flux-system"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].namespace").value("flux-system"));
    }

    @Test
    @DisplayName("PUT passes the decoded spec and the acting user to the service")
    void applySpec() throws Exception {
        when(kustomizationService.apply(eq(APPS), any(KustomizationSpec.class), anyString())).thenReturn(apps());

        mockMvc.perform(put("/api/kustomizations/flux-system/apps")
                .header(KustomizationController.ACTOR_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"interval": "10m", "retryInterval": "1m30s", "prune": true,
                     "sourceRef": {"kind": "GitRepository", "name": "repo"}}
                    """))
            .andExpect(status().isOk());

        ArgumentCaptor<KustomizationSpec> spec = ArgumentCaptor.forClass(KustomizationSpec.class);
        verify(kustomizationService).apply(eq(APPS), spec.capture(), eq("alice"));
        assertEquals(Duration.ofMinutes(10), spec.getValue().getInterval());
        assertEquals(Duration.ofSeconds(90), spec.getValue().getRetryInterval());
        assertTrue(spec.getValue().isPrune());
    }

    @Test
    void specWithoutSourceIsRejected() throws Exception {
        mockMvc.perform(put("/api/kustomizations/flux-system/apps")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"interval\": \"10m\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("GO-100"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("sourceRef"));

        verifyNoInteractions(kustomizationService);
    }

    @Test
    void malformedDurationIsRejected() throws Exception {
        mockMvc.perform(put("/api/kustomizations/flux-system/apps")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"interval\": \"often\", \"sourceRef\": {\"kind\": \"GitRepository\", \"name\": \"repo\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("GO-101"));
    }

    @Test
    void yamlManifestIsForwarded() throws Exception {
        String manifest = """
            apiVersion: kustomize.toolkit.fluxcd.io/v1
            kind: Kustomization
            metadata:
              name: apps
            spec:
              interval: 5m
            """;
        when(kustomizationService.applyManifest(manifest, "api")).thenReturn(apps());

        mockMvc.perform(post("/api/kustomizations")
                .contentType(KustomizationController.APPLICATION_YAML)
                .content(manifest))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("apps"));
    }

    @Test
    void invalidManifestIsBadRequest() throws Exception {
        when(kustomizationService.applyManifest(anyString(), anyString())).thenThrow(
            new ValidationException(ErrorCode.INVALID_MANIFEST, "Expected kind Kustomization, got 'ConfigMap'"));

        mockMvc.perform(post("/api/kustomizations")
                .contentType(KustomizationController.APPLICATION_YAML)
                .content("kind: ConfigMap"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("GO-104"));
        verify(metricsRegistry).incrementCounter("gitops.api.errors", "code", "GO-104", "fatal", "false");
    }

    @Test
    void reconcileAndDeleteAreAccepted() throws Exception {
        when(kustomizationService.requestReconcile(APPS)).thenReturn(apps());
        when(kustomizationService.delete(APPS, "api")).thenReturn(apps());

        mockMvc.perform(post("/api/kustomizations/flux-system/apps/reconcile"))
            .andExpect(status().isAccepted());
        mockMvc.perform(delete("/api/kustomizations/flux-system/apps"))
            .andExpect(status().isAccepted());

        verify(kustomizationService).requestReconcile(APPS);
        verify(kustomizationService).delete(APPS, "api");
    }

    @Test
    void suspendAndResume() throws Exception {
        when(kustomizationService.suspend(APPS, "bob")).thenReturn(apps());
        when(kustomizationService.resume(APPS, "api")).thenReturn(apps());

        mockMvc.perform(post("/api/kustomizations/flux-system/apps/suspend")
                .header(KustomizationController.ACTOR_HEADER, "bob"))
            .andExpect(status().isOk());
        mockMvc.perform(post("/api/kustomizations/flux-system/apps/resume"))
            .andExpect(status().isOk());

        verify(kustomizationService).suspend(APPS, "bob");
        verify(kustomizationService).resume(APPS, "api");
    }

    @Test
    void historyListsTransitions() throws Exception {
        when(kustomizationService.history(APPS)).thenReturn(List.of(
            new ConditionTransition(APPS.toString(), "Ready", null, ConditionStatus.UNKNOWN,
                "Progressing", "Reconciliation in progress", 1, Instant.parse("2024-05-01T12:00:00Z"))));

        mockMvc.perform(get("/api/kustomizations/flux-system/apps/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].type").value("Ready"))
            .andExpect(jsonPath("$[0].reason").value("Progressing"));
    }

    @Test
    void unsupportedMethodIsReported() throws Exception {
        mockMvc.perform(patch("/api/kustomizations/flux-system/apps"))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.code").value("GO-101"));
    }
}
