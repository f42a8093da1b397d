package com.questrail.osc.codec;

import com.questrail.osc.model.OscPacket;

/**
 * OscPacketEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for OSC packets.
 *
 * <p>The returned bytes are the exact OSC wire form, ready for a UDP datagram.
 * Stream transports add their own length prefix on top.</p>
 */
public interface OscPacketEncoder
{
    byte[] encode(OscPacket packet);
}
