package com.platform.gitops.reconciliation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A clock that only moves when told to.
 */
class ManualClock extends Clock {
    
    private volatile Instant now;
    
    ManualClock(Instant start) {
        this.now = start;
    }
    
    synchronized void advance(Duration duration) {
        now = now.plus(duration);
    }
    
    @Override
    public Instant instant() {
        return now;
    }
    
    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }
    
    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
