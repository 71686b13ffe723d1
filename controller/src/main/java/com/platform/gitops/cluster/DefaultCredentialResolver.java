package com.platform.gitops.cluster;

import com.platform.gitops.model.SecretReference;

/**
 * Produces impersonation handles without contacting the cluster; the transport interprets them.
 */
public class DefaultCredentialResolver implements CredentialResolver {

    @Override
    public ClusterCredential forServiceAccount(String namespace, String serviceAccountName) {
        return new ClusterCredential("system:serviceaccount:" + namespace + ":" + serviceAccountName);
    }

    @Override
    public ClusterCredential forKubeConfig(String namespace, SecretReference secretRef) {
        return new ClusterCredential("kubeconfig:" + namespace + "/" + secretRef.name());
    }

    @Override
    public ClusterCredential controllerDefault() {
        return ClusterCredential.CONTROLLER;
    }
}
