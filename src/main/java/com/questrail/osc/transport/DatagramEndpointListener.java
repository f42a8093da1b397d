package com.questrail.osc.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially by the implementation. Netty endpoints
 * deliver them on the channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called once per received datagram with the payload exactly as received.
     * Framework buffers have already been copied and released.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
