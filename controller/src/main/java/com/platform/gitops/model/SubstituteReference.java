package com.platform.gitops.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * ConfigMap or Secret in the unit's namespace whose data keys are used as substitution variables.
 */
public record SubstituteReference(
    @NotBlank @Pattern(regexp = "Secret|ConfigMap") String kind,
    @NotBlank @Size(max = 253) String name
) {

    public static final String SECRET = "Secret";
    public static final String CONFIG_MAP = "ConfigMap";
}
