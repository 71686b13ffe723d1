package com.platform.gitops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.gitops.manifest.TypeRegistry;
import com.platform.gitops.manifest.TypeRegistry.Scope;
import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationManifest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the registry of known kinds once at startup.
 */
@Slf4j
@Configuration
public class TypeRegistryConfig {
    
    private static final List<String> CORE_CLUSTER_KINDS = List.of(
        "Namespace", "Node", "PersistentVolume");
    
    private static final List<String[]> GROUP_CLUSTER_KINDS = List.of(
        new String[]{"rbac.authorization.k8s.io", "ClusterRole"},
        new String[]{"rbac.authorization.k8s.io", "ClusterRoleBinding"},
        new String[]{"apiextensions.k8s.io", "CustomResourceDefinition"},
        new String[]{"storage.k8s.io", "StorageClass"},
        new String[]{"scheduling.k8s.io", "PriorityClass"},
        new String[]{"admissionregistration.k8s.io", "ValidatingWebhookConfiguration"},
        new String[]{"admissionregistration.k8s.io", "MutatingWebhookConfiguration"},
        new String[]{"apiregistration.k8s.io", "APIService"});
    
    /**
     * @param extraClusterScoped additional cluster-scoped kinds as {@code group/Kind}, or
     *                           {@code Kind} for the core group
     */
    @Bean
    public TypeRegistry typeRegistry(ObjectMapper objectMapper,
                                     @Value("${gitops.types.cluster-scoped:}") List<String> extraClusterScoped) {
        TypeRegistry registry = new TypeRegistry(objectMapper);
        CORE_CLUSTER_KINDS.forEach(kind -> registry.register("", kind, Scope.CLUSTER));
        GROUP_CLUSTER_KINDS.forEach(gk -> registry.register(gk[0], gk[1], Scope.CLUSTER));
        registry.register(Kustomization.GROUP, Kustomization.KIND, Scope.NAMESPACED, KustomizationManifest.class);
        
        for (String entry : extraClusterScoped) {
            String value = entry.trim();
            if (value.isEmpty()) {
                continue;
            }
            int slash = value.lastIndexOf('/');
            String group = slash < 0 ? "" : value.substring(0, slash);
            registry.register(group, value.substring(slash + 1), Scope.CLUSTER);
        }
        log.info("Type registry initialized with {} kinds", registry.size());
        return registry;
    }
}
