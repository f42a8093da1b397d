package com.questrail.osc.observability;

/**
 * Receives per-packet and per-handler failures that do not stop the receive
 * loop. Implementations must not throw; anything they throw is logged and
 * discarded by the caller.
 */
@FunctionalInterface
public interface OscErrorHandler {
    void onError(OscErrorEvent event);
}
