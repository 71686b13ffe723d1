package com.platform.gitops.reconciliation;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.inventory.ResourceInventory;

/**
 * Shared between an attempt body and the thread waiting on it: the phase in flight and the
 * inventory of the last completed apply. Read by the waiter when the deadline cancels the body.
 */
public class AttemptProgress {
    
    private volatile ErrorCode phase = ErrorCode.ARTIFACT_FAILED;
    private volatile ResourceInventory appliedInventory;
    private volatile String revision;
    private volatile boolean cancelled;
    
    public void enter(ErrorCode phase) {
        this.phase = phase;
    }
    
    public ErrorCode phase() {
        return phase;
    }
    
    /**
     * Records the inventory computed once every object has been applied.
     */
    public void applied(ResourceInventory inventory) {
        this.appliedInventory = inventory;
    }
    
    /**
     * {@code null} until an apply pass has completed in this attempt.
     */
    public ResourceInventory appliedInventory() {
        return appliedInventory;
    }
    
    public void revision(String revision) {
        this.revision = revision;
    }
    
    public String revision() {
        return revision;
    }
    
    /**
     * Marks the attempt as abandoned by its waiter; the body must not persist anything after this.
     */
    public void cancel() {
        this.cancelled = true;
    }
    
    public boolean isCancelled() {
        return cancelled;
    }
}
