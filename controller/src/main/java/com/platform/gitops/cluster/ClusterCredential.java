package com.platform.gitops.cluster;

/**
 * Opaque handle to the identity used for cluster calls. Produced by {@link CredentialResolver}
 * and passed through to {@link ClusterClient} untouched.
 */
public record ClusterCredential(String handle) {

    public static final ClusterCredential CONTROLLER = new ClusterCredential("controller");

    @Override
    public String toString() {
        return handle;
    }
}
