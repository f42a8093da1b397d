package com.questrail.osc.observability;

/**
 * No-op implementation of OscErrorHandler.
 */
public final class NullOscErrorHandler implements OscErrorHandler {
    public static final NullOscErrorHandler INSTANCE = new NullOscErrorHandler();

    private NullOscErrorHandler() {}

    @Override
    public void onError(OscErrorEvent event) {}
}
