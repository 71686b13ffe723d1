package com.platform.gitops.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * How encrypted manifest values are decrypted before apply.
 */
public record Decryption(
    @NotBlank String provider,
    @Valid SecretReference secretRef
) {
}
