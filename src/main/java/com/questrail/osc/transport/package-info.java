/**
 * OSC Transport
 * =============================================================================
 *
 * <p>Sending and receiving OSC packets over UDP, TCP and Unix-domain sockets.</p>
 *
 * <h2>Blocking path</h2>
 * <ul>
 *   <li>{@link com.questrail.osc.transport.OscAddress} sends to one destination.
 *       Stream destinations connect lazily on the first send.</li>
 *   <li>{@link com.questrail.osc.transport.OscServer} binds, waits on a
 *       {@link java.nio.channels.Selector} and dispatches one packet per
 *       {@code receive} call on the calling thread.</li>
 *   <li>{@link com.questrail.osc.transport.OscServerThread} runs that loop on a
 *       dedicated thread.</li>
 * </ul>
 *
 * <h2>Event-driven path</h2>
 * <p>{@link com.questrail.osc.transport.DatagramEndpoint} and
 * {@link com.questrail.osc.transport.DatagramEndpointListener} form a
 * framework-agnostic datagram port. The Netty implementation lives in
 * {@code transport.udp.netty}; Netty types never leave that package.</p>
 *
 * <h2>Stream framing</h2>
 * <p>TCP and Unix transports prefix every packet with a 4-byte big-endian
 * length ({@code transport.stream}). UDP datagrams carry exactly one packet
 * and are never framed.</p>
 */
package com.questrail.osc.transport;
