package com.platform.gitops.apply;

import com.platform.gitops.model.ObjectIdentifier;

/**
 * One line of the change set reported for an attempt, e.g. {@code Deployment/apps/web configured}.
 */
public record ChangeSetEntry(ObjectIdentifier id, String action) {

    @Override
    public String toString() {
        return id.displayName() + " " + action;
    }
}
