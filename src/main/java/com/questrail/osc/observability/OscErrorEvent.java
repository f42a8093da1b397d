package com.questrail.osc.observability;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;

import java.time.Instant;
import java.util.Objects;

/**
 * Record describing a non-fatal failure: a bad packet, a receive fault or a
 * handler that threw.
 *
 * <p>{@code component} names where the failure was observed, for example
 * {@code "OscServer.receive"} or {@code "OscDispatcher.dispatchMessage"}.
 * {@code cause} may be null.</p>
 */
public record OscErrorEvent(
    Instant timestamp,
    OscErrorCode code,
    String message,
    String component,
    Throwable cause
) {
    public OscErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(component, "component");
    }

    /**
     * Builds an event from a caught {@link OscException}, keeping its code.
     */
    public static OscErrorEvent of(Instant timestamp, OscException e, String component) {
        return new OscErrorEvent(timestamp, e.code(), String.valueOf(e.getMessage()), component, e);
    }
}
