package com.questrail.osc.transport;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.config.OscTransportConfig;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscValue;
import com.questrail.osc.transport.stream.OscStreamFraming;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OscAddressTest
 * -----------------------------------------------------------------------------
 * Sending over loopback sockets owned by the test.
 */
final class OscAddressTest
{
    private static final String LOOPBACK = "127.0.0.1";

    @Test
    void udpSendDeliversExactPacketBytes() throws IOException
    {
        try (DatagramChannel receiver = DatagramChannel.open()) {
            receiver.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            int port = ((InetSocketAddress) receiver.getLocalAddress()).getPort();

            OscMessage m = OscMessage.builder("/udp").addInt32(7).addString("seven").build();
            try (OscAddress address = new OscAddress(LOOPBACK, port, OscProtocol.UDP)) {
                assertTrue(address.send(m));
                assertFalse(address.isConnected());
            }

            ByteBuffer buf = ByteBuffer.allocate(1024);
            receiver.receive(buf);
            buf.flip();
            byte[] received = new byte[buf.remaining()];
            buf.get(received);
            assertArrayEquals(m.serialize(), received);
        }
    }

    @Test
    void tcpSendConnectsLazilyAndFramesEachPacket() throws IOException
    {
        try (ServerSocketChannel listener = ServerSocketChannel.open()) {
            listener.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            int port = ((InetSocketAddress) listener.getLocalAddress()).getPort();

            OscMessage first = OscMessage.of("/tcp/1", OscValue.float32(1.5f));
            OscMessage second = OscMessage.of("/tcp/2");
            try (OscAddress address = new OscAddress(LOOPBACK, port, OscProtocol.TCP)) {
                assertFalse(address.isConnected());
                assertTrue(address.send(first));
                assertTrue(address.isConnected());
                assertTrue(address.send(second));

                try (SocketChannel peer = listener.accept()) {
                    OscStreamFraming framing = OscStreamFraming.forOsc(OscTransportConfig.DEFAULT_MAX_MESSAGE_SIZE);
                    assertArrayEquals(first.serialize(), framing.receiveFramed(peer).orElseThrow());
                    assertArrayEquals(second.serialize(), framing.receiveFramed(peer).orElseThrow());
                }
            }
        }
    }

    @Test
    void tcpSendToClosedPortFailsWithoutThrowing() throws IOException
    {
        int port;
        try (ServerSocketChannel probe = ServerSocketChannel.open()) {
            probe.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            port = ((InetSocketAddress) probe.getLocalAddress()).getPort();
        }

        try (OscAddress address = new OscAddress(LOOPBACK, port, OscProtocol.TCP)) {
            assertFalse(address.send(OscMessage.of("/nobody")));
            assertTrue(address.lastError().isPresent());
            assertFalse(address.isConnected());
        }
    }

    @Test
    void oversizePayloadIsRejectedBeforeSending()
    {
        OscTransportConfig config = OscTransportConfig.builder()
                .withHost(LOOPBACK).withPort(9).withMaxMessageSize(16).build();
        try (OscAddress address = new OscAddress(config)) {
            OscException e = assertThrows(OscException.class, () -> address.send(new byte[17]));
            assertEquals(OscErrorCode.MESSAGE_TOO_LARGE, e.code());
        }
    }

    @Test
    void closedAddressRefusesToSend()
    {
        OscAddress address = new OscAddress(LOOPBACK, 9, OscProtocol.UDP);
        address.close();
        address.close();

        OscException e = assertThrows(OscException.class, () -> address.send(new byte[8]));
        assertEquals(OscErrorCode.SOCKET_ERROR, e.code());
    }

    @Test
    void unresolvableHostIsAnAddressError()
    {
        OscException e = assertThrows(OscException.class,
                () -> new OscAddress("no-such-host.invalid", 9000, OscProtocol.UDP));
        assertEquals(OscErrorCode.ADDRESS_ERROR, e.code());
    }

    @Test
    void optionsApplyOnlyToTheirProtocol()
    {
        try (OscAddress udp = new OscAddress(LOOPBACK, 9000, OscProtocol.UDP);
             OscAddress tcp = new OscAddress(LOOPBACK, 9000, OscProtocol.TCP)) {
            assertTrue(udp.setTtl(300));
            assertEquals(255, udp.config().ttl());
            assertFalse(udp.setNoDelay(false));

            assertFalse(tcp.setTtl(4));
            assertTrue(tcp.setNoDelay(false));
            assertFalse(tcp.config().noDelay());

            assertTrue(tcp.setTimeout(Duration.ofSeconds(1)));
            assertFalse(tcp.setTimeout(Duration.ofSeconds(-1)));
            assertEquals(Duration.ofSeconds(1), tcp.config().timeout());
        }
    }

    @Test
    void urlRoundTripsThroughFromUrl()
    {
        try (OscAddress address = OscAddress.fromUrl("osc.udp://127.0.0.1:9100/")) {
            assertEquals("osc.udp://127.0.0.1:9100/", address.url());
            assertEquals(OscProtocol.UDP, address.protocol());
            assertEquals("127.0.0.1", address.host());
            assertEquals(9100, address.port());

            try (OscAddress copy = address.copy()) {
                assertNotSame(address, copy);
                assertEquals(address.url(), copy.url());
            }
        }
    }

    @Test
    void rawBytesAreSentVerbatimOverUdp() throws IOException
    {
        try (DatagramChannel receiver = DatagramChannel.open()) {
            receiver.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            int port = ((InetSocketAddress) receiver.getLocalAddress()).getPort();

            byte[] raw = {1, 2, 3, 4, 5};
            try (OscAddress address = new OscAddress(LOOPBACK, port, OscProtocol.UDP)) {
                assertTrue(address.send(raw));
            }

            ByteBuffer buf = ByteBuffer.allocate(64);
            receiver.receive(buf);
            assertArrayEquals(raw, Arrays.copyOf(buf.array(), buf.position()));
        }
    }
}
