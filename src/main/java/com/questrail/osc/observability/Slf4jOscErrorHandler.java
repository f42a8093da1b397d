package com.questrail.osc.observability;

import com.questrail.osc.OscErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default OscErrorHandler that emits logs via SLF4J.
 *
 * <p>Malformed input from the network is logged at {@code warn}; everything
 * else, handler failures included, at {@code error}.</p>
 */
public final class Slf4jOscErrorHandler implements OscErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOscErrorHandler.class);

    public static final Slf4jOscErrorHandler INSTANCE = new Slf4jOscErrorHandler();

    @Override
    public void onError(OscErrorEvent event) {
        if (isInputDefect(event.code())) {
            log.warn("OSC {} in {}: {}", event.code(), event.component(), event.message());
        } else {
            log.error("OSC {} in {}: {}", event.code(), event.component(), event.message(), event.cause());
        }
    }

    private static boolean isInputDefect(OscErrorCode code) {
        switch (code) {
            case MALFORMED_PACKET:
            case DESERIALIZATION_ERROR:
            case ADDRESS_ERROR:
            case MESSAGE_TOO_LARGE:
                return true;
            default:
                return false;
        }
    }
}
