package com.platform.gitops.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Secret holding a kubeconfig under the {@code value} key, used to reconcile on a remote cluster.
 */
public record KubeConfigReference(@NotNull @Valid SecretReference secretRef) {
}
