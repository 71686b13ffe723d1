package com.platform.gitops.cluster;

/**
 * What an apply call did to the live object.
 */
public enum ApplyAction {
    CREATED,
    CONFIGURED,
    UNCHANGED,
    /**
     * Deleted and created again after an immutable field conflict.
     */
    RECREATED;

    public boolean isMutation() {
        return this != UNCHANGED;
    }

    public String describe() {
        return name().toLowerCase();
    }
}
