package com.platform.gitops.inventory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.gitops.model.ObjectIdentifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered record of the objects applied by the last reconciliation.
 * Instances are immutable; a new inventory replaces the previous one as a whole.
 */
public final class ResourceInventory {

    private static final ResourceInventory EMPTY = new ResourceInventory(List.of());

    private final List<ObjectIdentifier> entries;

    @JsonCreator
    public ResourceInventory(@JsonProperty("entries") List<ObjectIdentifier> entries) {
        this.entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static ResourceInventory empty() {
        return EMPTY;
    }

    public static ResourceInventory of(Collection<ObjectIdentifier> objects) {
        return new ResourceInventory(new ArrayList<>(objects));
    }

    @JsonProperty("entries")
    public List<ObjectIdentifier> entries() {
        return entries;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(ObjectIdentifier id) {
        String key = id.inventoryId();
        return entries.stream().anyMatch(e -> e.inventoryId().equals(key));
    }

    /**
     * Objects recorded here that are absent from {@code current}, in reverse inventory order so
     * that they can be deleted in the opposite order they were applied.
     * Identity ignores the API version.
     */
    public List<ObjectIdentifier> staleAgainst(Collection<ObjectIdentifier> current) {
        Set<String> keep = new HashSet<>();
        current.forEach(id -> keep.add(id.inventoryId()));
        List<ObjectIdentifier> stale = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0; i--) {
            ObjectIdentifier entry = entries.get(i);
            if (!keep.contains(entry.inventoryId())) {
                stale.add(entry);
            }
        }
        return stale;
    }

    /**
     * Checks the structural invariants: every entry has a kind, a name and a version, and no
     * identity appears twice.
     *
     * @throws InvalidInventoryException when an invariant does not hold
     */
    public void validate() {
        Map<String, ObjectIdentifier> seen = new LinkedHashMap<>();
        for (ObjectIdentifier entry : entries) {
            if (entry == null) {
                throw new InvalidInventoryException("inventory contains a null entry");
            }
            if (isBlank(entry.kind()) || isBlank(entry.name()) || isBlank(entry.version())) {
                throw new InvalidInventoryException("inventory entry is incomplete: " + entry.inventoryId());
            }
            if (seen.putIfAbsent(entry.inventoryId(), entry) != null) {
                throw new InvalidInventoryException("inventory entry is duplicated: " + entry.inventoryId());
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResourceInventory other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceInventory" + entries;
    }
}
