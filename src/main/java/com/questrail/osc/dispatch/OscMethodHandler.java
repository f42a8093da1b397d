package com.questrail.osc.dispatch;

import com.questrail.osc.model.OscMessage;

/**
 * Callback invoked for each message whose address and type tags match a
 * registered method. Runs on the dispatching thread.
 */
@FunctionalInterface
public interface OscMethodHandler {
    void handle(OscMessage message);
}
