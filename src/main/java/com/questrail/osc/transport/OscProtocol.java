package com.questrail.osc.transport;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;

/**
 * Transport protocol of an OSC endpoint, with its URL scheme.
 */
public enum OscProtocol
{
    UDP("osc.udp"),
    TCP("osc.tcp"),
    UNIX("osc.unix");

    private final String scheme;

    OscProtocol(String scheme) {
        this.scheme = scheme;
    }

    public String scheme() {
        return scheme;
    }

    /**
     * True for byte-stream transports, which carry length-prefixed frames.
     */
    public boolean isStream() {
        return this != UDP;
    }

    /**
     * @throws OscException {@link OscErrorCode#ADDRESS_ERROR} for an unknown scheme
     */
    public static OscProtocol fromScheme(String scheme) {
        for (OscProtocol p : values()) {
            if (p.scheme.equalsIgnoreCase(scheme)) {
                return p;
            }
        }
        throw new OscException(OscErrorCode.ADDRESS_ERROR, "Unknown OSC URL scheme: " + scheme);
    }
}
