package com.questrail.osc.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to stamp OSC time tags and error events.
 *
 * <p>
 * Injected wherever "now" matters so that tests can pin the current time.
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
