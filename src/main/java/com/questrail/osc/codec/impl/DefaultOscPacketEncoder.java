package com.questrail.osc.codec.impl;

import com.questrail.osc.codec.OscPacketEncoder;
import com.questrail.osc.model.OscBundle;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscPacket;

import java.util.Objects;

/**
 * DefaultOscPacketEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link OscPacketEncoder}; the mechanical inverse
 * of {@link DefaultOscPacketDecoder}.
 */
public final class DefaultOscPacketEncoder implements OscPacketEncoder
{
    @Override
    public byte[] encode(OscPacket packet)
    {
        Objects.requireNonNull(packet, "packet");
        if (packet instanceof OscMessage m) {
            return OscMessageCodec.encode(m);
        }
        return OscBundleCodec.encode((OscBundle) packet);
    }
}
