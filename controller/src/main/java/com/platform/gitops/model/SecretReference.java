package com.platform.gitops.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Reference to a Secret in the namespace of the referring unit.
 */
public record SecretReference(@NotBlank String name) {
}
