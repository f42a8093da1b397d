package com.questrail.osc.model;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.internal.time.SystemWallClock;
import com.questrail.osc.internal.time.WallClock;

import java.time.Instant;
import java.util.Objects;

/**
 * OSC time tag: a 64-bit NTP fixed-point timestamp.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>{@code seconds}: unsigned 32-bit seconds since 1900-01-01T00:00:00Z</li>
 *   <li>{@code fraction}: unsigned 32-bit fraction of a second (units of 2<sup>-32</sup> s)</li>
 * </ul>
 *
 * <p>Both words are held in {@code long} components and restricted to
 * {@code 0..0xFFFFFFFF}. Ordering compares seconds, then fraction, both unsigned.</p>
 *
 * <p>The pair {@code (0, 1)} is reserved: it means "execute immediately" and is
 * returned by {@link #immediate()}.</p>
 */
public record OscTimeTag(long seconds, long fraction) implements Comparable<OscTimeTag>
{
    /** Seconds between the NTP epoch (1900) and the Unix epoch (1970). */
    public static final long NTP_UNIX_OFFSET_SECONDS = 2_208_988_800L;

    private static final long UINT32_MASK = 0xFFFF_FFFFL;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final OscTimeTag IMMEDIATE = new OscTimeTag(0, 1);

    public OscTimeTag {
        if (seconds < 0 || seconds > UINT32_MASK) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "Time tag seconds out of uint32 range: " + seconds);
        }
        if (fraction < 0 || fraction > UINT32_MASK) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "Time tag fraction out of uint32 range: " + fraction);
        }
    }

    /**
     * Returns the "execute immediately" sentinel {@code (0, 1)}.
     */
    public static OscTimeTag immediate() {
        return IMMEDIATE;
    }

    /**
     * Returns the current system time as a time tag.
     */
    public static OscTimeTag now() {
        return now(SystemWallClock.INSTANCE);
    }

    public static OscTimeTag now(WallClock clock) {
        return of(Objects.requireNonNull(clock, "clock").now());
    }

    /**
     * Builds a time tag from a 64-bit NTP word (seconds in the high 32 bits).
     */
    public static OscTimeTag ofNtp(long ntp) {
        return new OscTimeTag(ntp >>> 32, ntp & UINT32_MASK);
    }

    /**
     * Converts a wall-clock instant to NTP representation.
     *
     * @throws OscException if the instant falls outside the NTP era 0 range
     */
    public static OscTimeTag of(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        long ntpSeconds = instant.getEpochSecond() + NTP_UNIX_OFFSET_SECONDS;
        if (ntpSeconds < 0 || ntpSeconds > UINT32_MASK) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "Instant outside NTP era 0: " + instant);
        }
        // rounded up so that toInstant() recovers the exact nanosecond
        long fraction = (((long) instant.getNano() << 32) + NANOS_PER_SECOND - 1) / NANOS_PER_SECOND;
        return new OscTimeTag(ntpSeconds, fraction);
    }

    /**
     * Returns the 64-bit NTP word for this time tag.
     */
    public long toNtp() {
        return (seconds << 32) | fraction;
    }

    /**
     * Converts back to wall-clock time. Sub-nanosecond precision is truncated;
     * a tag built by {@link #of(Instant)} converts back to the same instant.
     */
    public Instant toInstant() {
        long nanos = (fraction * NANOS_PER_SECOND) >>> 32;
        return Instant.ofEpochSecond(seconds - NTP_UNIX_OFFSET_SECONDS, nanos);
    }

    public boolean isImmediate() {
        return seconds == 0 && fraction == 1;
    }

    public boolean isBefore(OscTimeTag other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(OscTimeTag other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(OscTimeTag other) {
        int bySeconds = Long.compare(seconds, other.seconds);
        return bySeconds != 0 ? bySeconds : Long.compare(fraction, other.fraction);
    }

    @Override
    public String toString() {
        if (isImmediate()) {
            return "OscTimeTag[immediate]";
        }
        return "OscTimeTag[" + seconds + "." + String.format("%08X", fraction) + "]";
    }
}
