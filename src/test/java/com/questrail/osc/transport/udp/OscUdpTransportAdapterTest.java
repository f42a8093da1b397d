package com.questrail.osc.transport.udp;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.codec.impl.DefaultOscPacketDecoder;
import com.questrail.osc.codec.impl.DefaultOscPacketEncoder;
import com.questrail.osc.dispatch.OscDispatcher;
import com.questrail.osc.internal.time.SystemWallClock;
import com.questrail.osc.model.OscBundle;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscPacket;
import com.questrail.osc.model.OscTimeTag;
import com.questrail.osc.model.OscValue;
import com.questrail.osc.observability.RecordingErrorHandler;
import com.questrail.osc.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class OscUdpTransportAdapterTest {

    private static final InetSocketAddress REMOTE = new InetSocketAddress("127.0.0.1", 9000);

    private FakeDatagramEndpoint endpoint;
    private RecordingErrorHandler errors;
    private List<OscMessage> received;
    private OscUdpTransportAdapter adapter;

    @BeforeEach
    void setUp() {
        endpoint = new FakeDatagramEndpoint();
        errors = new RecordingErrorHandler();
        received = new ArrayList<>();

        OscDispatcher dispatcher = new OscDispatcher(errors, SystemWallClock.INSTANCE);
        dispatcher.addMethod("/mixer/*/gain", "f", received::add);

        adapter = new OscUdpTransportAdapter(endpoint,
                new DefaultOscPacketDecoder(),
                new DefaultOscPacketEncoder(),
                dispatcher);
    }

    @Test
    void inboundDatagramIsDecodedThenDispatched() {
        OscMessage m = OscMessage.of("/mixer/3/gain", OscValue.float32(0.5f));

        endpoint.injectDatagram(REMOTE, m.serialize());

        assertEquals(List.of(m), received);
        assertTrue(errors.isEmpty());
    }

    @Test
    void inboundBundleDispatchesEveryMessage() {
        OscBundle bundle = OscBundle.of(OscTimeTag.immediate(),
                OscMessage.of("/mixer/1/gain", OscValue.float32(1f)),
                OscMessage.of("/mixer/2/gain", OscValue.float32(2f)));

        endpoint.injectDatagram(REMOTE, bundle.serialize());

        assertEquals(2, received.size());
    }

    @Test
    void undecodableDatagramIsReportedAndDropped() {
        endpoint.injectDatagram(REMOTE, new byte[] {'/', 'x'});

        assertTrue(received.isEmpty());
        assertEquals(List.of(OscErrorCode.MALFORMED_PACKET), errors.codes());
        assertEquals(OscUdpTransportAdapter.COMPONENT, errors.events().get(0).component());
        assertTrue(errors.events().get(0).message().contains("127.0.0.1"));
    }

    @Test
    void sendEncodesOnePacketPerDatagram() {
        OscPacket packet = OscMessage.of("/reply", OscValue.string("ok"));

        adapter.send(REMOTE, packet);

        assertEquals(1, endpoint.sent().size());
        FakeDatagramEndpoint.Sent sent = endpoint.sent().get(0);
        assertEquals(REMOTE, sent.remote());
        assertArrayEquals(packet.serialize(), sent.payload());
    }

    @Test
    void sendRejectsPacketsLargerThanTheEndpointCarries() {
        FakeDatagramEndpoint small = new FakeDatagramEndpoint(32);
        OscUdpTransportAdapter limited = new OscUdpTransportAdapter(small,
                new DefaultOscPacketDecoder(), new DefaultOscPacketEncoder(), new OscDispatcher());

        OscException e = assertThrows(OscException.class,
                () -> limited.send(REMOTE, OscMessage.of("/big", OscValue.blob(new byte[24]))));

        assertEquals(OscErrorCode.MESSAGE_TOO_LARGE, e.code());
        assertTrue(small.sent().isEmpty());

        limited.send(REMOTE, OscMessage.of("/fits"));
        assertEquals(1, small.sent().size());
    }

    @Test
    void lifecycleFollowsTheEndpoint() {
        assertFalse(adapter.isUp());

        adapter.start();
        assertTrue(adapter.isUp());

        adapter.stop();
        assertFalse(adapter.isUp());
        assertTrue(errors.isEmpty());
    }

    @Test
    void transportFailureIsReportedAsNetworkError() {
        adapter.start();

        endpoint.failTransport(new IOException("interface gone"));

        assertFalse(adapter.isUp());
        assertEquals(List.of(OscErrorCode.NETWORK_ERROR), errors.codes());
        assertTrue(errors.events().get(0).message().contains("interface gone"));
    }
}
