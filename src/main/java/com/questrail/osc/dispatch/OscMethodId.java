package com.questrail.osc.dispatch;

/**
 * Opaque handle returned by method registration and accepted by
 * {@link OscDispatcher#removeMethod(OscMethodId)}.
 */
public record OscMethodId(long value) {
    @Override
    public String toString() {
        return "OscMethodId[" + value + "]";
    }
}
