package com.platform.gitops.cluster;

import com.platform.gitops.model.ObjectIdentifier;

/**
 * Outcome of applying one object.
 */
public record AppliedObject(ObjectIdentifier id, ApplyAction action) {

    public String describe() {
        return id.displayName() + " " + action.describe();
    }
}
