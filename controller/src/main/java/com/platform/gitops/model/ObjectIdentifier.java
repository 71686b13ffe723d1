package com.platform.gitops.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;

/**
 * Identity of a cluster object: group, version, kind, namespace and name.
 * Cluster-scoped objects carry an empty namespace.
 */
public record ObjectIdentifier(
    String group,
    String version,
    String kind,
    String namespace,
    String name
) {

    /**
     * Deterministic ordering used for diagnostics: group, kind, namespace, name.
     */
    public static final Comparator<ObjectIdentifier> DIAGNOSTIC_ORDER = Comparator
        .comparing(ObjectIdentifier::group)
        .thenComparing(ObjectIdentifier::kind)
        .thenComparing(ObjectIdentifier::namespace)
        .thenComparing(ObjectIdentifier::name);

    public ObjectIdentifier {
        group = group == null ? "" : group;
        version = version == null ? "" : version;
        namespace = namespace == null ? "" : namespace;
    }

    /**
     * Builds an identifier from a manifest {@code apiVersion} such as {@code apps/v1} or {@code v1}.
     */
    public static ObjectIdentifier of(String apiVersion, String kind, String namespace, String name) {
        String group = "";
        String version = apiVersion == null ? "" : apiVersion;
        int slash = version.indexOf('/');
        if (slash >= 0) {
            group = version.substring(0, slash);
            version = version.substring(slash + 1);
        }
        return new ObjectIdentifier(group, version, kind, namespace, name);
    }

    @JsonIgnore
    public String apiVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    @JsonIgnore
    public boolean isClusterScoped() {
        return namespace.isEmpty();
    }

    /**
     * Version independent key, {@code namespace_name_group_kind}.
     */
    @JsonIgnore
    public String inventoryId() {
        return namespace + "_" + name + "_" + group + "_" + kind;
    }

    /**
     * Human readable form, {@code Kind/namespace/name} or {@code Kind/name}.
     */
    @JsonIgnore
    public String displayName() {
        return namespace.isEmpty() ? kind + "/" + name : kind + "/" + namespace + "/" + name;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
