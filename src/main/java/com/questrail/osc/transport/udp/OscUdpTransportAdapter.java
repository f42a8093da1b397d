package com.questrail.osc.transport.udp;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.codec.OscPacketDecoder;
import com.questrail.osc.codec.OscPacketEncoder;
import com.questrail.osc.dispatch.OscDispatcher;
import com.questrail.osc.model.OscPacket;
import com.questrail.osc.transport.DatagramEndpoint;
import com.questrail.osc.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * OscUdpTransportAdapter
 * =============================================================================
 * Connects an event-driven {@link DatagramEndpoint} to the OSC codec and an
 * {@link OscDispatcher}.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 *
 * <pre>
 *   DatagramEndpoint
 *        → OscPacketDecoder
 *            → OscDispatcher
 *                → handlers (on the endpoint's callback thread)
 * </pre>
 *
 * <h2>Outbound path</h2>
 *
 * <pre>
 *   OscPacket
 *        → OscPacketEncoder
 *            → DatagramEndpoint.send(...)
 * </pre>
 *
 * <p>Invalid datagrams are reported to the dispatcher's error handler and
 * dropped. This adapter adds no retries or scheduling.</p>
 */
public class OscUdpTransportAdapter implements DatagramEndpointListener {

    private static final Logger log = LoggerFactory.getLogger(OscUdpTransportAdapter.class);

    static final String COMPONENT = "OscUdpTransportAdapter.onDatagram";

    private final DatagramEndpoint endpoint;
    private final OscPacketDecoder decoder;
    private final OscPacketEncoder encoder;
    private final OscDispatcher dispatcher;

    private volatile boolean up;

    public OscUdpTransportAdapter(DatagramEndpoint endpoint,
                                  OscPacketDecoder decoder,
                                  OscPacketEncoder encoder,
                                  OscDispatcher dispatcher) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isUp() {
        return up;
    }

    public OscDispatcher dispatcher() {
        return dispatcher;
    }

    /**
     * Encode and send one packet as a single datagram.
     *
     * @throws OscException {@link OscErrorCode#MESSAGE_TOO_LARGE} if the encoded
     *         packet exceeds the endpoint's maximum datagram size
     */
    public void send(SocketAddress remote, OscPacket packet) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(packet, "packet");

        byte[] payload = encoder.encode(packet);
        if (payload.length > endpoint.maxDatagramSize()) {
            throw new OscException(OscErrorCode.MESSAGE_TOO_LARGE,
                    "Packet of " + payload.length + " bytes exceeds maximum datagram size "
                            + endpoint.maxDatagramSize() + " for " + remote);
        }
        endpoint.send(remote, payload);
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        up = true;
        log.info("OSC UDP transport up");
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        if (cause == null) {
            log.info("OSC UDP transport down");
        } else {
            dispatcher.reportError(OscErrorCode.NETWORK_ERROR,
                    "UDP transport down: " + cause.getMessage(), COMPONENT, cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        final OscPacket packet;
        try {
            packet = decoder.decode(payload);
        } catch (OscException e) {
            dispatcher.reportError(e.code(),
                    "Dropping datagram from " + remote + ": " + e.getMessage(), COMPONENT, e);
            return;
        }

        dispatcher.dispatch(packet);
    }
}
