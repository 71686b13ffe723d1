package com.platform.gitops.apply;

import com.platform.gitops.manifest.ManifestObject;

import java.util.Comparator;
import java.util.List;

/**
 * Kind based apply order: namespaces and definitions first, then access control, configuration,
 * services, workloads and finally everything else. Sorting with this comparator is stable, so
 * objects of the same rank keep their render order.
 */
public final class ApplyOrder {

    private static final List<String> KIND_ORDER = List.of(
        "Namespace",
        "ResourceQuota",
        "StorageClass",
        "CustomResourceDefinition",
        "ServiceAccount",
        "PodSecurityPolicy",
        "Role",
        "ClusterRole",
        "RoleBinding",
        "ClusterRoleBinding",
        "ConfigMap",
        "Secret",
        "Endpoints",
        "Service",
        "LimitRange",
        "PriorityClass",
        "PersistentVolume",
        "PersistentVolumeClaim",
        "Deployment",
        "StatefulSet",
        "CronJob",
        "PodDisruptionBudget"
    );

    public static final Comparator<ManifestObject> COMPARATOR = Comparator.comparingInt(o -> rank(o.kind()));

    private ApplyOrder() {
    }

    public static int rank(String kind) {
        int index = KIND_ORDER.indexOf(kind);
        return index >= 0 ? index : KIND_ORDER.size();
    }
}
