package com.platform.gitops.inventory;

/**
 * Raised when a stored inventory breaks its structural invariants.
 */
public class InvalidInventoryException extends RuntimeException {

    public InvalidInventoryException(String message) {
        super(message);
    }
}
