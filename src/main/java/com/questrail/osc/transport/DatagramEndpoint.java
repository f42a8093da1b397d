package com.questrail.osc.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for an event-driven datagram transport.
 *
 * <p>This endpoint only moves bytes. The layer above it is responsible for:</p>
 * <ul>
 *   <li>decoding inbound datagrams into OSC packets</li>
 *   <li>dispatching decoded packets</li>
 *   <li>encoding outbound packets before {@link #send(SocketAddress, byte[])}</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test double.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation the endpoint notifies its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void stop();

    /**
     * Send one datagram. A datagram sent before the endpoint is up is dropped.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Largest payload this endpoint carries in one datagram.
     */
    int maxDatagramSize();

    /**
     * Register the listener that receives datagrams and lifecycle events.
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
