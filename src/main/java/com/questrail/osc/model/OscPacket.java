package com.questrail.osc.model;

import com.questrail.osc.codec.impl.DefaultOscPacketDecoder;

/**
 * Unit of OSC transmission: either a single {@link OscMessage} or an
 * {@link OscBundle} of further packets.
 */
public sealed interface OscPacket permits OscMessage, OscBundle
{
    /**
     * Wire form of this packet. The result length is always a multiple of 4.
     */
    byte[] serialize();

    default boolean isBundle() {
        return this instanceof OscBundle;
    }

    /**
     * Decodes a complete packet, choosing bundle or message by the
     * {@code #bundle} magic.
     */
    static OscPacket deserialize(byte[] data) {
        return new DefaultOscPacketDecoder().decode(data);
    }
}
