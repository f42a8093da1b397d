package com.questrail.osc.dispatch;

import com.questrail.osc.model.OscBundle;

/**
 * Hook invoked before or after the elements of a bundle are dispatched.
 */
@FunctionalInterface
public interface OscBundleHandler {
    void onBundle(OscBundle bundle);
}
