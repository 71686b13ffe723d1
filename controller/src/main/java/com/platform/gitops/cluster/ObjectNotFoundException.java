package com.platform.gitops.cluster;

import com.platform.gitops.model.ObjectIdentifier;

/**
 * The addressed object does not exist.
 */
public class ObjectNotFoundException extends ClusterException {

    public ObjectNotFoundException(ObjectIdentifier id) {
        super(id.displayName() + " not found");
    }
}
