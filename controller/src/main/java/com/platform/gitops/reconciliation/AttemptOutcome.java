package com.platform.gitops.reconciliation;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.model.UnitKey;

/**
 * What one attempt ended with, as far as scheduling is concerned.
 *
 * @param error failure code, {@code null} unless {@link Result#FAILED}
 */
public record AttemptOutcome(UnitKey key, Result result, ErrorCode error, String message) {
    
    public enum Result {
        SUCCEEDED,
        FAILED,
        /**
         * Skipped because the unit is suspended.
         */
        SUSPENDED,
        /**
         * The unit was finalized and removed from the store.
         */
        REMOVED,
        NOT_FOUND
    }
    
    public static AttemptOutcome succeeded(UnitKey key, String message) {
        return new AttemptOutcome(key, Result.SUCCEEDED, null, message);
    }
    
    public static AttemptOutcome failed(UnitKey key, ErrorCode error, String message) {
        return new AttemptOutcome(key, Result.FAILED, error, message);
    }
    
    public static AttemptOutcome of(UnitKey key, Result result) {
        return new AttemptOutcome(key, result, null, null);
    }
    
    public boolean isTerminal() {
        return result == Result.REMOVED || result == Result.NOT_FOUND;
    }
}
