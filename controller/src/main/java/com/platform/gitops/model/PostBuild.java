package com.platform.gitops.model;

import jakarta.validation.Valid;

import java.util.List;
import java.util.Map;

/**
 * Actions performed on the rendered manifests after the overlay build.
 */
public record PostBuild(
    Map<String, String> substitute,
    List<@Valid SubstituteReference> substituteFrom
) {

    public PostBuild {
        substitute = substitute == null ? Map.of() : Map.copyOf(substitute);
        substituteFrom = substituteFrom == null ? List.of() : List.copyOf(substituteFrom);
    }
}
