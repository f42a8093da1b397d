/**
 * OSC Codec Implementation
 * =============================================================================
 *
 * <p>Concrete codec classes. {@link com.questrail.osc.codec.impl.OscArgumentCodec}
 * owns per-type payload rules, {@link com.questrail.osc.codec.impl.OscMessageCodec}
 * and {@link com.questrail.osc.codec.impl.OscBundleCodec} own packet structure,
 * and the {@code Default*} classes expose them through the codec interfaces.</p>
 *
 * <pre>
 *   byte[]
 *        → DefaultOscPacketDecoder
 *            → OscBundleCodec   (if "#bundle")
 *            → OscMessageCodec  (otherwise)
 *                → OscArgumentCodec per type tag
 * </pre>
 *
 * <p>Every failure is an {@link com.questrail.osc.OscException} carrying a
 * structured code. Nothing here performs I/O.</p>
 */
package com.questrail.osc.codec.impl;
