package com.questrail.osc.codec.impl;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.codec.OscPacketDecoder;
import com.questrail.osc.model.OscPacket;

import java.util.Objects;

/**
 * DefaultOscPacketDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link OscPacketDecoder}.
 *
 * <p>Payloads starting with {@code #bundle} are decoded as bundles, up to a
 * configurable nesting depth; everything else is decoded as a message.</p>
 */
public final class DefaultOscPacketDecoder implements OscPacketDecoder
{
    private final int maxBundleDepth;

    public DefaultOscPacketDecoder() {
        this(OscBundleCodec.DEFAULT_MAX_DEPTH);
    }

    public DefaultOscPacketDecoder(int maxBundleDepth) {
        if (maxBundleDepth < 0) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "maxBundleDepth must be >= 0 (was " + maxBundleDepth + ")");
        }
        this.maxBundleDepth = maxBundleDepth;
    }

    @Override
    public OscPacket decode(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");
        return decode(packet, 0, packet.length);
    }

    public OscPacket decode(byte[] packet, int offset, int length)
    {
        if (OscBundleCodec.isBundle(packet, offset, length)) {
            return OscBundleCodec.decode(packet, offset, length, maxBundleDepth);
        }
        return OscMessageCodec.decode(packet, offset, length);
    }
}
