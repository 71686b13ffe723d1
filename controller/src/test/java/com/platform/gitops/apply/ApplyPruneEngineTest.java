package com.platform.gitops.apply;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.gitops.cluster.ClusterException;
import com.platform.gitops.cluster.InMemoryClusterClient;
import com.platform.gitops.config.TypeRegistryConfig;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.error.ReconciliationTimeoutException;
import com.platform.gitops.inventory.ResourceInventory;
import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.manifest.ManifestParser;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.KustomizationStatus;
import com.platform.gitops.model.ObjectIdentifier;
import com.platform.gitops.model.SourceReference;
import com.platform.gitops.observability.MetricsRegistry;
import com.platform.gitops.observability.StructuredLogger;
import com.platform.gitops.reconciliation.AttemptProgress;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApplyPruneEngineTest {

    private static final ObjectIdentifier NS = ObjectIdentifier.of("v1", "Namespace", null, "apps");
    private static final ObjectIdentifier CM = ObjectIdentifier.of("v1", "ConfigMap", "apps", "settings");
    private static final ObjectIdentifier WEB = ObjectIdentifier.of("apps/v1", "Deployment", "apps", "web");

    private InMemoryClusterClient cluster;
    private ManifestParser parser;
    private ApplyPruneEngine engine;
    private Deadline deadline;

    @BeforeEach
    void setUp() {
        cluster = new InMemoryClusterClient();
        parser = new ManifestParser(new TypeRegistryConfig().typeRegistry(new ObjectMapper(), List.of()));
        engine = new ApplyPruneEngine(cluster, new MetricsRegistry(new SimpleMeterRegistry()),
            new StructuredLogger("gitops-controller-test", "test"));
        deadline = Deadline.after(Duration.ofMinutes(1), Clock.systemUTC());
    }

    private static Kustomization unit(boolean prune, boolean force, ResourceInventory inventory) {
        return Kustomization.builder()
            .namespace("flux-system")
            .name("apps")
            .spec(KustomizationSpec.builder()
                .interval(Duration.ofMinutes(5))
                .prune(prune)
                .force(force)
                .sourceRef(new SourceReference("GitRepository", "repo", null))
                .build())
            .status(KustomizationStatus.builder().inventory(inventory).build())
            .build();
    }

    private ManifestObject namespace() {
        return parser.parseObject("apiVersion: v1\nkind: Namespace\nmetadata:\n  name: apps\n");
    }

    private ManifestObject configMap(String value) {
        return parser.parseObject("""
            apiVersion: v1
            kind: ConfigMap
            metadata:
              name: settings
              namespace: apps
            data:
              mode: "%s"
            """.formatted(value));
    }

    private ManifestObject deployment(String app) {
        return parser.parseObject("""
            apiVersion: apps/v1
            kind: Deployment
            metadata:
              name: web
              namespace: apps
            spec:
              selector:
                matchLabels:
                  app: %s
            """.formatted(app));
    }

    private ApplyResult reconcile(Kustomization unit, ManifestObject... objects) {
        return engine.reconcile(unit, List.of(objects), null, deadline, new AttemptProgress());
    }

    @Test
    @DisplayName("Objects are applied in kind order and stamped with the owner labels")
    void appliesInKindOrder() {
        ApplyResult result = reconcile(unit(true, false, null), deployment("web"), configMap("a"), namespace());

        assertEquals(List.of(NS, CM, WEB), result.inventory().entries());
        assertEquals("apps", cluster.get(WEB, null).orElseThrow().labels().get(ApplyPruneEngine.NAME_LABEL));
        assertEquals("flux-system", cluster.get(WEB, null).orElseThrow().labels().get(ApplyPruneEngine.NAMESPACE_LABEL));
        assertEquals(3, result.changeSet().size());
        assertTrue(result.summary().contains("Namespace/apps created"));
        assertTrue(result.failure().isEmpty());
    }

    @Test
    void reapplyingTheSameRenderChangesNothing() {
        ApplyResult first = reconcile(unit(true, false, null), configMap("a"));

        ApplyResult second = reconcile(unit(true, false, first.inventory()), configMap("a"));

        assertFalse(second.hasMutations());
        assertEquals("no changes", second.summary());
        assertEquals(first.inventory(), second.inventory());
    }

    @Test
    void changedObjectIsConfigured() {
        ApplyResult first = reconcile(unit(true, false, null), configMap("a"));

        ApplyResult second = reconcile(unit(true, false, first.inventory()), configMap("b"));

        assertEquals(List.of(new ChangeSetEntry(CM, "configured")), second.changeSet());
        assertEquals("b", cluster.get(CM, null).orElseThrow().at("data", "mode").asText());
    }

    @Test
    @DisplayName("Stale inventory entries are deleted exactly once")
    void prunesStaleObjectsOnce() {
        ApplyResult first = reconcile(unit(true, false, null), configMap("a"), deployment("web"));

        ApplyResult second = reconcile(unit(true, false, first.inventory()), configMap("a"));
        ApplyResult third = reconcile(unit(true, false, second.inventory()), configMap("a"));

        assertEquals(List.of(WEB), second.pruned());
        assertFalse(cluster.contains(WEB));
        assertTrue(third.pruned().isEmpty());
        assertEquals(1, cluster.deletions().size());
    }

    @Test
    void pruneDisabledOnUnitKeepsStaleObjects() {
        ApplyResult first = reconcile(unit(false, false, null), configMap("a"), deployment("web"));

        ApplyResult second = reconcile(unit(false, false, first.inventory()), configMap("a"));

        assertTrue(cluster.contains(WEB));
        assertEquals(List.of(CM), second.inventory().entries());
    }

    @Test
    void pruneDisabledAnnotationSkipsObject() {
        ManifestObject keep = deployment("web");
        ((ObjectNode) keep.content().get("metadata")).putObject("annotations")
            .put(ApplyPruneEngine.PRUNE_ANNOTATION, ApplyPruneEngine.DISABLED);
        ApplyResult first = reconcile(unit(true, false, null), configMap("a"), keep);

        ApplyResult second = reconcile(unit(true, false, first.inventory()), configMap("a"));

        assertTrue(cluster.contains(WEB));
        assertEquals(List.of(WEB), second.skipped());
        assertTrue(second.pruned().isEmpty());
    }

    @Test
    @DisplayName("Without an inventory, owned objects missing from the render are discovered and pruned")
    void prunesOwnedObjectsWithoutInventory() {
        reconcile(unit(true, false, null), configMap("a"), deployment("web"));

        ApplyResult result = reconcile(unit(true, false, null), configMap("a"));

        assertEquals(List.of(WEB), result.pruned());
        assertFalse(cluster.contains(WEB));
    }

    @Test
    @DisplayName("A failing object is reported while the rest is still applied")
    void partialFailure() {
        cluster.injectFailure(CM, new ClusterException("quota exceeded"));

        ApplyResult result = reconcile(unit(true, false, null), namespace(), configMap("a"), deployment("web"));

        assertEquals(List.of(NS, WEB), result.inventory().entries());
        ReconciliationException failure = result.failure().orElseThrow();
        assertEquals(ErrorCode.APPLY_FAILED, failure.getErrorCode());
        assertEquals("ConfigMap/apps/settings: quota exceeded", failure.getMessage());
    }

    @Test
    void immutableFieldChangeFailsWithoutForce() {
        ApplyResult first = reconcile(unit(true, false, null), deployment("web"));

        ApplyResult second = reconcile(unit(true, false, first.inventory()), deployment("api"));

        assertTrue(second.failure().isPresent());
        assertTrue(second.applyErrors().get(0).contains("spec.selector"));
        assertEquals("web", cluster.get(WEB, null).orElseThrow().at("spec", "selector", "matchLabels", "app").asText());
    }

    @Test
    @DisplayName("With force, an immutable field change recreates the object")
    void forceRecreates() {
        ApplyResult first = reconcile(unit(true, true, null), deployment("web"));

        ApplyResult second = reconcile(unit(true, true, first.inventory()), deployment("api"));

        assertTrue(second.failure().isEmpty());
        assertEquals(List.of(new ChangeSetEntry(WEB, "recreated")), second.changeSet());
        assertEquals("api", cluster.get(WEB, null).orElseThrow().at("spec", "selector", "matchLabels", "app").asText());
    }

    @Test
    void deleteInventoryRemovesInReverseOrder() {
        ApplyResult applied = reconcile(unit(true, false, null), namespace(), configMap("a"), deployment("web"));

        ApplyResult deleted = engine.deleteInventory(applied.inventory(), null, deadline);

        assertEquals(List.of(WEB.inventoryId(), CM.inventoryId(), NS.inventoryId()), cluster.deletions());
        assertTrue(deleted.inventory().isEmpty());
        assertTrue(deleted.failure().isEmpty());
    }

    @Test
    void deleteFailureLeavesEntryInInventory() {
        ApplyResult applied = reconcile(unit(true, false, null), configMap("a"), deployment("web"));
        cluster.injectFailure(CM, new ClusterException("forbidden"));

        ApplyResult deleted = engine.deleteInventory(applied.inventory(), null, deadline);

        assertEquals(List.of(CM), deleted.inventory().entries());
        assertEquals(ErrorCode.PRUNE_FAILED, deleted.failure().orElseThrow().getErrorCode());
    }

    @Test
    void malformedPreviousInventoryIsRejected() {
        ResourceInventory duplicated = ResourceInventory.of(List.of(CM, CM));

        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> reconcile(unit(true, false, duplicated), configMap("a")));
        assertTrue(e.getMessage().startsWith("previous inventory is invalid"));
        assertEquals(0, cluster.mutationCount());
    }

    @Test
    void expiredDeadlineStopsTheApply() {
        Deadline expired = Deadline.after(Duration.ZERO, Clock.systemUTC());

        ReconciliationTimeoutException e = assertThrows(ReconciliationTimeoutException.class,
            () -> engine.reconcile(unit(true, false, null), List.of(configMap("a")), null, expired, new AttemptProgress()));
        assertEquals(ErrorCode.APPLY_FAILED, e.getErrorCode());
        assertEquals(0, cluster.mutationCount());
    }
}
