/**
 * OSC Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> of the OSC core:
 * the encoder and decoder interfaces that translate between
 * {@link com.questrail.osc.model.OscPacket} and the OSC 1.0 binary form.</p>
 *
 * <h2>Wire Rules</h2>
 * <ul>
 *   <li>All multi-byte numbers are big-endian</li>
 *   <li>Strings are NUL-terminated and zero-padded to a multiple of 4</li>
 *   <li>Blobs carry an int32 size and are zero-padded to a multiple of 4</li>
 *   <li>Bundle elements are prefixed by their int32 size</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] datagram / de-framed stream payload
 *        → OscPacketDecoder
 *            → OscMessage | OscBundle
 *                → OscDispatcher
 *                    → handlers
 * </pre>
 *
 * <p>Transport concerns (stream framing, datagram size limits) live in
 * {@code com.questrail.osc.transport}; address matching lives in
 * {@code com.questrail.osc.pattern}.</p>
 */
package com.questrail.osc.codec;
