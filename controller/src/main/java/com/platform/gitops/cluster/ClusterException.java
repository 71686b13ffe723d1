package com.platform.gitops.cluster;

/**
 * Failure reported by the cluster API transport.
 */
public class ClusterException extends RuntimeException {

    public ClusterException(String message) {
        super(message);
    }

    public ClusterException(String message, Throwable cause) {
        super(message, cause);
    }
}
