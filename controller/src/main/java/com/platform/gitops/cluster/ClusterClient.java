package com.platform.gitops.cluster;

import com.platform.gitops.manifest.ManifestObject;
import com.platform.gitops.model.ObjectIdentifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability surface of the cluster API transport.
 * Implementations must honour thread interruption in blocking calls.
 */
public interface ClusterClient {

    /**
     * Upserts the object with server-side apply semantics.
     *
     * @throws ImmutableFieldException when the change touches an immutable field
     * @throws ClusterException on any other rejection
     */
    AppliedObject apply(ManifestObject object, ClusterCredential credential);

    /**
     * Deletes the object.
     *
     * @throws ObjectNotFoundException when it does not exist
     * @throws ClusterException on any other rejection
     */
    void delete(ObjectIdentifier id, ClusterCredential credential);

    /**
     * Reads the live object, including its status.
     */
    Optional<ManifestObject> get(ObjectIdentifier id, ClusterCredential credential);

    /**
     * Lists every object carrying all of the given labels.
     */
    List<ManifestObject> listByLabels(Map<String, String> labels, ClusterCredential credential);
}
