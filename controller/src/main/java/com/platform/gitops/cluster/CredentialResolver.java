package com.platform.gitops.cluster;

import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.KustomizationSpec;
import com.platform.gitops.model.SecretReference;

/**
 * Resolves impersonation references into credentials.
 */
public interface CredentialResolver {

    /**
     * Credential impersonating a service account in the given namespace.
     */
    ClusterCredential forServiceAccount(String namespace, String serviceAccountName);

    /**
     * Credential for a remote cluster described by a kubeconfig secret.
     */
    ClusterCredential forKubeConfig(String namespace, SecretReference secretRef);

    /**
     * The controller's own identity.
     */
    ClusterCredential controllerDefault();

    /**
     * Picks the credential for a unit: kubeconfig first, then service account, then the
     * controller's own identity.
     */
    default ClusterCredential resolve(Kustomization kustomization) {
        KustomizationSpec spec = kustomization.getSpec();
        if (spec.getKubeConfig() != null) {
            return forKubeConfig(kustomization.getNamespace(), spec.getKubeConfig().secretRef());
        }
        if (spec.getServiceAccountName() != null && !spec.getServiceAccountName().isBlank()) {
            return forServiceAccount(kustomization.getNamespace(), spec.getServiceAccountName());
        }
        return controllerDefault();
    }
}
