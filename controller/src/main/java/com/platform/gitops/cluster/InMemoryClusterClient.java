package com.platform.gitops.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.model.ObjectIdentifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map backed cluster used when no real transport is wired in.
 * Keeps the {@code status} stanza of stored objects across applies, rejects changes to a small
 * set of immutable fields and counts mutations.
 */
@Slf4j
public class InMemoryClusterClient implements ClusterClient {

    private static final Map<String, Set<String>> IMMUTABLE_FIELDS = Map.of(
        "Deployment", Set.of("spec/selector"),
        "StatefulSet", Set.of("spec/selector", "spec/serviceName"),
        "DaemonSet", Set.of("spec/selector"),
        "Job", Set.of("spec/selector", "spec/template"),
        "Service", Set.of("spec/clusterIP")
    );

    private final Map<String, ManifestObject> objects = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> injectedFailures = new ConcurrentHashMap<>();
    private final AtomicLong mutations = new AtomicLong();
    private final List<String> deletions = new ArrayList<>();

    @Override
    public AppliedObject apply(ManifestObject object, ClusterCredential credential) {
        ObjectIdentifier id = object.identifier();
        throwInjected(id);
        ManifestObject desired = object.deepCopy();
        desired.content().remove("status");
        ManifestObject existing = objects.get(id.inventoryId());
        if (existing == null) {
            objects.put(id.inventoryId(), desired);
            mutations.incrementAndGet();
            log.debug("Created {} as {}", id, credential);
            return new AppliedObject(id, ApplyAction.CREATED);
        }
        ManifestObject current = existing.deepCopy();
        JsonNode status = current.content().remove("status");
        if (current.equals(desired)) {
            return new AppliedObject(id, ApplyAction.UNCHANGED);
        }
        for (String field : IMMUTABLE_FIELDS.getOrDefault(id.kind(), Set.of())) {
            JsonNode before = current.content().at("/" + field);
            JsonNode after = desired.content().at("/" + field);
            if (!before.isMissingNode() && !before.equals(after)) {
                throw new ImmutableFieldException(id, field.replace('/', '.'));
            }
        }
        if (status != null) {
            desired.content().set("status", status);
        }
        objects.put(id.inventoryId(), desired);
        mutations.incrementAndGet();
        log.debug("Configured {} as {}", id, credential);
        return new AppliedObject(id, ApplyAction.CONFIGURED);
    }

    @Override
    public void delete(ObjectIdentifier id, ClusterCredential credential) {
        throwInjected(id);
        if (objects.remove(id.inventoryId()) == null) {
            throw new ObjectNotFoundException(id);
        }
        mutations.incrementAndGet();
        synchronized (deletions) {
            deletions.add(id.inventoryId());
        }
        log.debug("Deleted {} as {}", id, credential);
    }

    @Override
    public Optional<ManifestObject> get(ObjectIdentifier id, ClusterCredential credential) {
        return Optional.ofNullable(objects.get(id.inventoryId())).map(ManifestObject::deepCopy);
    }

    @Override
    public List<ManifestObject> listByLabels(Map<String, String> labels, ClusterCredential credential) {
        return objects.values().stream()
            .filter(o -> o.labels().entrySet().containsAll(labels.entrySet()))
            .map(ManifestObject::deepCopy)
            .toList();
    }

    /**
     * Replaces the status stanza of a stored object, as a workload controller would.
     */
    public void setStatus(ObjectIdentifier id, ObjectNode status) {
        ManifestObject stored = objects.get(id.inventoryId());
        if (stored == null) {
            throw new ObjectNotFoundException(id);
        }
        stored.content().set("status", status);
    }

    /**
     * Stores an object directly, bypassing apply.
     */
    public void put(ManifestObject object) {
        objects.put(object.identifier().inventoryId(), object.deepCopy());
    }

    /**
     * Makes every subsequent apply and delete of the object fail with the given exception.
     */
    public void injectFailure(ObjectIdentifier id, RuntimeException failure) {
        injectedFailures.put(id.inventoryId(), failure);
    }

    public boolean contains(ObjectIdentifier id) {
        return objects.containsKey(id.inventoryId());
    }

    public int size() {
        return objects.size();
    }

    public long mutationCount() {
        return mutations.get();
    }

    /**
     * Inventory ids of deleted objects, in deletion order.
     */
    public List<String> deletions() {
        synchronized (deletions) {
            return List.copyOf(deletions);
        }
    }

    private void throwInjected(ObjectIdentifier id) {
        RuntimeException failure = injectedFailures.get(id.inventoryId());
        if (failure != null) {
            throw failure;
        }
    }
}
