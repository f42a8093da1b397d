package com.questrail.osc.transport;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.config.OscTransportConfig;
import com.questrail.osc.model.OscPacket;
import com.questrail.osc.transport.stream.OscStreamFraming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * OscAddress
 * =============================================================================
 * A send-only OSC destination.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Construction resolves the host eagerly; an unresolvable host is an
 *       {@link OscErrorCode#ADDRESS_ERROR}.</li>
 *   <li>UDP opens an unconnected {@link DatagramChannel}; the destination is
 *       supplied with every datagram.</li>
 *   <li>TCP and Unix connect lazily on the first {@link #send(byte[])}. A failed
 *       stream send drops the connection so that the next send reconnects.</li>
 *   <li>{@link #close()} releases the channel.</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <p>A payload above {@code maxMessageSize} is rejected with
 * {@link OscErrorCode#MESSAGE_TOO_LARGE} before any I/O. An I/O failure makes
 * {@code send} return {@code false}; the cause is kept in {@link #lastError()}.</p>
 *
 * <h2>Threading</h2>
 * <p>Not thread-safe. Each sending thread should own its instance.</p>
 */
public final class OscAddress implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(OscAddress.class);

    private OscTransportConfig config;
    private final SocketAddress target;
    private final OscStreamFraming framing;

    private DatagramChannel datagramChannel;
    private SocketChannel streamChannel;
    private Exception lastError;
    private boolean closed;

    public OscAddress(String host, int port, OscProtocol protocol) {
        this(OscTransportConfig.builder()
                .withProtocol(protocol)
                .withHost(host)
                .withPort(port)
                .build());
    }

    public OscAddress(OscUrl url) {
        this(configFor(Objects.requireNonNull(url, "url")));
    }

    public OscAddress(OscTransportConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.target = resolve(config);
        this.framing = new OscStreamFraming(config.maxMessageSize(), 0, config.maxFrameRetries());
        if (config.protocol() == OscProtocol.UDP) {
            this.datagramChannel = openDatagram();
        }
        else if (config.protocol() == OscProtocol.UNIX) {
            checkUnixSupported();
        }
    }

    public static OscAddress unix(String path) {
        return new OscAddress(OscUrl.unix(path));
    }

    public static OscAddress fromUrl(String url) {
        return new OscAddress(OscUrl.parse(url));
    }

    // -------------------------------------------------------------------------
    // Sending
    // -------------------------------------------------------------------------

    public boolean send(OscPacket packet) {
        Objects.requireNonNull(packet, "packet");
        return send(packet.serialize());
    }

    /**
     * Sends one packet's bytes; stream transports add the length prefix.
     *
     * @return true on success, false on an I/O failure (see {@link #lastError()})
     * @throws OscException {@link OscErrorCode#MESSAGE_TOO_LARGE} if the payload
     *         exceeds the configured maximum
     */
    public boolean send(byte[] data) {
        Objects.requireNonNull(data, "data");
        if (closed) {
            throw new OscException(OscErrorCode.SOCKET_ERROR, "Address " + url() + " is closed");
        }
        if (data.length > config.maxMessageSize()) {
            throw new OscException(OscErrorCode.MESSAGE_TOO_LARGE,
                    "Message of " + data.length + " bytes exceeds maximum " + config.maxMessageSize()
                            + " for " + url());
        }

        try {
            if (config.protocol() == OscProtocol.UDP) {
                int sent = datagramChannel.send(ByteBuffer.wrap(data), target);
                if (sent != data.length) {
                    throw new OscException(OscErrorCode.NETWORK_ERROR,
                            "Datagram truncated: sent " + sent + " of " + data.length + " bytes");
                }
            }
            else {
                framing.sendFramed(ensureConnected(), data);
            }
            lastError = null;
            return true;
        }
        catch (IOException | OscException e) {
            lastError = e;
            log.warn("Send to {} failed: {}", url(), e.getMessage());
            resetConnection();
            return false;
        }
    }

    private SocketChannel ensureConnected() throws IOException {
        if (streamChannel != null && streamChannel.isConnected()) {
            return streamChannel;
        }
        SocketChannel ch = null;
        try {
            if (config.protocol() == OscProtocol.UNIX) {
                ch = SocketChannel.open(StandardProtocolFamily.UNIX);
                ch.connect(target);
            }
            else {
                ch = SocketChannel.open();
                ch.setOption(StandardSocketOptions.TCP_NODELAY, config.noDelay());
                int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, config.timeout().toMillis());
                ch.socket().connect(target, timeoutMillis);
            }
        }
        catch (IOException e) {
            closeQuietly(ch);
            throw new OscException(OscErrorCode.SOCKET_ERROR,
                    "Cannot connect to " + url() + ": " + e.getMessage(), e);
        }
        streamChannel = ch;
        log.debug("Connected to {}", url());
        return ch;
    }

    private void resetConnection() {
        if (streamChannel != null) {
            closeQuietly(streamChannel);
            streamChannel = null;
        }
    }

    // -------------------------------------------------------------------------
    // Options
    // -------------------------------------------------------------------------

    /**
     * Sets the multicast time-to-live, clamped to 1..255.
     *
     * @return false unless this is a UDP address
     */
    public boolean setTtl(int ttl) {
        if (config.protocol() != OscProtocol.UDP) {
            return false;
        }
        int clamped = Math.max(1, Math.min(255, ttl));
        try {
            datagramChannel.setOption(StandardSocketOptions.IP_MULTICAST_TTL, clamped);
        }
        catch (IOException e) {
            lastError = e;
            log.warn("Cannot set TTL on {}: {}", url(), e.getMessage());
            return false;
        }
        config = config.toBuilder().withTtl(clamped).build();
        return true;
    }

    /**
     * Enables or disables Nagle's algorithm.
     *
     * @return false unless this is a TCP address
     */
    public boolean setNoDelay(boolean noDelay) {
        if (config.protocol() != OscProtocol.TCP) {
            return false;
        }
        config = config.toBuilder().withNoDelay(noDelay).build();
        if (streamChannel != null && streamChannel.isOpen()) {
            try {
                streamChannel.setOption(StandardSocketOptions.TCP_NODELAY, noDelay);
            }
            catch (IOException e) {
                lastError = e;
                log.warn("Cannot set TCP_NODELAY on {}: {}", url(), e.getMessage());
                return false;
            }
        }
        return true;
    }

    /**
     * Sets the timeout applied when a stream connection is established.
     * {@link Duration#ZERO} waits indefinitely.
     *
     * @return false if the timeout is negative
     */
    public boolean setTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            return false;
        }
        config = config.toBuilder().withTimeout(timeout).build();
        return true;
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public OscProtocol protocol() {
        return config.protocol();
    }

    public String host() {
        return config.host();
    }

    public int port() {
        return config.port();
    }

    public OscTransportConfig config() {
        return config;
    }

    public boolean isConnected() {
        return streamChannel != null && streamChannel.isConnected();
    }

    public Optional<Exception> lastError() {
        return Optional.ofNullable(lastError);
    }

    public String url() {
        if (config.protocol() == OscProtocol.UNIX) {
            return OscUrl.unix(config.unixPath()).toString();
        }
        return OscUrl.of(config.protocol(), config.host(), config.port()).toString();
    }

    /**
     * Returns a new, independent address with the same configuration.
     */
    public OscAddress copy() {
        return new OscAddress(config);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        resetConnection();
        if (datagramChannel != null) {
            closeQuietly(datagramChannel);
            datagramChannel = null;
        }
        log.debug("Closed {}", url());
    }

    @Override
    public String toString() {
        return "OscAddress[" + url() + "]";
    }

    // -------------------------------------------------------------------------
    // Setup helpers
    // -------------------------------------------------------------------------

    private static OscTransportConfig configFor(OscUrl url) {
        OscTransportConfig.Builder b = OscTransportConfig.builder().withProtocol(url.protocol());
        if (url.protocol() == OscProtocol.UNIX) {
            return b.withUnixPath(url.path()).build();
        }
        return b.withHost(url.host()).withPort(url.port()).build();
    }

    private static SocketAddress resolve(OscTransportConfig config) {
        if (config.protocol() == OscProtocol.UNIX) {
            try {
                return UnixDomainSocketAddress.of(config.unixPath());
            }
            catch (RuntimeException e) {
                throw new OscException(OscErrorCode.ADDRESS_ERROR,
                        "Invalid Unix socket path '" + config.unixPath() + "': " + e.getMessage(), e);
            }
        }
        InetSocketAddress address = new InetSocketAddress(config.host(), config.port());
        if (address.isUnresolved()) {
            throw new OscException(OscErrorCode.ADDRESS_ERROR,
                    "Cannot resolve host '" + config.host() + "' (port " + config.port() + ")");
        }
        return address;
    }

    private DatagramChannel openDatagram() {
        try {
            DatagramChannel ch = DatagramChannel.open();
            ch.setOption(StandardSocketOptions.IP_MULTICAST_TTL, config.ttl());
            return ch;
        }
        catch (IOException e) {
            throw new OscException(OscErrorCode.SOCKET_ERROR,
                    "Cannot open UDP socket for " + url() + ": " + e.getMessage(), e);
        }
    }

    private static void checkUnixSupported() {
        try {
            SocketChannel.open(StandardProtocolFamily.UNIX).close();
        }
        catch (UnsupportedOperationException e) {
            throw new OscException(OscErrorCode.NOT_IMPLEMENTED,
                    "Unix domain sockets are not supported on this platform", e);
        }
        catch (IOException e) {
            throw new OscException(OscErrorCode.SOCKET_ERROR,
                    "Cannot create Unix domain socket: " + e.getMessage(), e);
        }
    }

    static void closeQuietly(Closeable ch) {
        if (ch == null) {
            return;
        }
        try {
            ch.close();
        }
        catch (IOException e) {
            log.debug("Ignoring failure while closing channel: {}", e.getMessage());
        }
    }
}
