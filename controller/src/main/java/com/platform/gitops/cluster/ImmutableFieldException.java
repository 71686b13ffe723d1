package com.platform.gitops.cluster;

import com.platform.gitops.model.ObjectIdentifier;

/**
 * An update was rejected because it changes a field that cannot change after creation.
 */
public class ImmutableFieldException extends ClusterException {

    private final ObjectIdentifier id;

    public ImmutableFieldException(ObjectIdentifier id, String field) {
        super(String.format("%s: field is immutable: %s", id.displayName(), field));
        this.id = id;
    }

    public ObjectIdentifier getId() {
        return id;
    }
}
