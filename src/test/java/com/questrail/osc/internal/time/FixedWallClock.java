package com.questrail.osc.internal.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Test-only {@link WallClock} that returns a settable instant.
 */
public final class FixedWallClock implements WallClock
{
    private Instant now;

    public FixedWallClock(Instant now) {
        this.now = Objects.requireNonNull(now, "now");
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    public synchronized void set(Instant now) {
        this.now = Objects.requireNonNull(now, "now");
    }
}
