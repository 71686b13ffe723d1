package com.platform.gitops.error;

import com.platform.gitops.model.DurationFormat;

import java.time.Duration;

/**
 * The attempt deadline passed while a phase was running. Surfaces with the reason of that phase.
 */
public class ReconciliationTimeoutException extends ReconciliationException {
    
    private final Duration timeout;
    
    public ReconciliationTimeoutException(ErrorCode phase, Duration timeout, String detail) {
        super(phase, String.format("timeout of %s exceeded: %s", DurationFormat.format(timeout), detail));
        this.timeout = timeout;
    }
    
    public Duration getTimeout() {
        return timeout;
    }
}
