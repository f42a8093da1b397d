package com.questrail.osc.codec;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.model.OscPacket;

/**
 * OscPacketDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for complete OSC packets.
 *
 * <p>This interface is the inbound boundary between raw transport bytes (one
 * UDP datagram, or one de-framed stream payload) and a structured
 * {@link OscPacket}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Choosing bundle or message by the {@code #bundle} magic</li>
 *   <li>Validating structure, alignment and declared sizes</li>
 *   <li>Constructing the packet on success</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Matching addresses or invoking handlers</li>
 *   <li>Honouring bundle time tags</li>
 *   <li>Buffering partial data across calls</li>
 * </ul>
 */
public interface OscPacketDecoder
{
    /**
     * Decodes exactly one packet from a complete payload.
     *
     * @param packet raw bytes received from the transport
     * @return the decoded message or bundle
     * @throws OscException with {@link OscErrorCode#MALFORMED_PACKET},
     *         {@link OscErrorCode#DESERIALIZATION_ERROR} or
     *         {@link OscErrorCode#ADDRESS_ERROR} when the payload is invalid
     */
    OscPacket decode(byte[] packet);
}
