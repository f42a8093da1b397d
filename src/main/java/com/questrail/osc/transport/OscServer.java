package com.questrail.osc.transport;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.codec.OscPacketDecoder;
import com.questrail.osc.codec.impl.DefaultOscPacketDecoder;
import com.questrail.osc.config.OscTransportConfig;
import com.questrail.osc.dispatch.OscBundleHandler;
import com.questrail.osc.dispatch.OscDispatcher;
import com.questrail.osc.dispatch.OscMethodHandler;
import com.questrail.osc.dispatch.OscMethodId;
import com.questrail.osc.model.OscPacket;
import com.questrail.osc.observability.OscErrorHandler;
import com.questrail.osc.transport.stream.OscStreamFraming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.DatagramChannel;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OscServer
 * =============================================================================
 * Receives OSC packets on one bound endpoint and dispatches them.
 *
 * <h2>Receive model</h2>
 * <p>{@link #receive(Duration)} blocks the calling thread on a
 * {@link Selector} until one packet has been processed or the timeout
 * elapses. For stream protocols it also accepts new connections; each
 * connection keeps its own partial-frame state, so a frame split across
 * several reads is reassembled transparently.</p>
 *
 * <pre>
 *   datagram / de-framed payload
 *        → OscPacketDecoder  ("#bundle" or message)
 *            → OscDispatcher
 *                → handlers (on the receiving thread)
 * </pre>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>Bind failures throw {@link OscErrorCode#SOCKET_ERROR} from the constructor.</li>
 *   <li>A bad packet, an oversize datagram or a broken connection is reported
 *       to the error handler and {@code receive} returns {@code false}.</li>
 *   <li>Handler failures are reported by the dispatcher and do not make
 *       {@code receive} fail.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>{@code receive} must be called from one thread at a time. {@link #close()}
 * and {@link #wakeup()} may be called from any thread.</p>
 */
public final class OscServer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(OscServer.class);

    static final String COMPONENT = "OscServer.receive";

    private final OscTransportConfig config;
    private final OscDispatcher dispatcher;
    private final OscPacketDecoder decoder;
    private final OscStreamFraming framing;

    private final Selector selector;
    private final SelectableChannel listenChannel;
    private final ByteBuffer datagramBuffer;
    private final int boundPort;

    private final Set<SocketChannel> connections = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private SelectionKey pendingKey;

    private enum ReadResult { PACKET, FAILED, CLOSED, NOTHING }

    public OscServer(int port, OscProtocol protocol) {
        this(OscTransportConfig.builder().withProtocol(protocol).withPort(port).build());
    }

    public OscServer(OscTransportConfig config) {
        this(config, new OscDispatcher());
    }

    public OscServer(OscTransportConfig config, OscDispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.decoder = new DefaultOscPacketDecoder();
        this.framing = OscStreamFraming.forOsc(config.maxMessageSize());
        this.datagramBuffer = ByteBuffer.allocate(config.maxMessageSize() + 1);

        Selector sel = null;
        SelectableChannel ch = null;
        try {
            sel = Selector.open();
            ch = bind(config);
            ch.configureBlocking(false);
            ch.register(sel, config.protocol().isStream() ? SelectionKey.OP_ACCEPT : SelectionKey.OP_READ);
        }
        catch (IOException | UnsupportedOperationException e) {
            OscAddress.closeQuietly(ch);
            OscAddress.closeQuietly(sel);
            if (e instanceof UnsupportedOperationException) {
                throw new OscException(OscErrorCode.NOT_IMPLEMENTED,
                        "Unix domain sockets are not supported on this platform", e);
            }
            throw new OscException(OscErrorCode.SOCKET_ERROR,
                    "Cannot bind " + describe(config) + ": " + e.getMessage(), e);
        }
        this.selector = sel;
        this.listenChannel = ch;
        this.boundPort = localPort(ch);
        log.info("OSC server listening on {}", url());
    }

    public static OscServer unix(String path) {
        return new OscServer(OscTransportConfig.builder()
                .withProtocol(OscProtocol.UNIX)
                .withUnixPath(path)
                .build());
    }

    // -------------------------------------------------------------------------
    // Registry (delegates to the dispatcher)
    // -------------------------------------------------------------------------

    public OscMethodId addMethod(String pattern, String typeSignature, OscMethodHandler handler) {
        return dispatcher.addMethod(pattern, typeSignature, handler);
    }

    public OscMethodId addDefaultMethod(OscMethodHandler handler) {
        return dispatcher.addDefaultMethod(handler);
    }

    public boolean removeMethod(OscMethodId id) {
        return dispatcher.removeMethod(id);
    }

    public void setBundleHandlers(OscBundleHandler start, OscBundleHandler end) {
        dispatcher.setBundleHandlers(start, end);
    }

    public void setErrorHandler(OscErrorHandler handler) {
        dispatcher.setErrorHandler(handler);
    }

    public OscDispatcher dispatcher() {
        return dispatcher;
    }

    // -------------------------------------------------------------------------
    // Receiving
    // -------------------------------------------------------------------------

    /**
     * Waits without a timeout for one packet and dispatches it.
     */
    public boolean receive() {
        return receive(null);
    }

    /**
     * Waits up to {@code timeout} for one packet and dispatches it.
     * A {@code null} timeout waits indefinitely; {@link Duration#ZERO} polls.
     *
     * @return true if a packet was decoded and dispatched; false on timeout,
     *         on a closed peer, on a reported per-packet failure, after
     *         {@link #wakeup()} or once the server is closed
     */
    public boolean receive(Duration timeout) {
        long deadline = deadlineOf(timeout);
        while (!closed.get()) {
            Optional<byte[]> buffered = pollBufferedFrame();
            if (buffered.isPresent()) {
                return process(buffered.get());
            }

            SelectionKey key = nextReadable(timeout, deadline);
            if (key == null) {
                return false;
            }
            switch (read(key)) {
                case PACKET:
                    return true;
                case FAILED:
                case CLOSED:
                    return false;
                default:
                    // spurious readiness or a partial frame; keep waiting
                    break;
            }
        }
        return false;
    }

    /**
     * Waits up to {@code timeout} until a packet can be read without blocking.
     * Does not consume the packet.
     */
    public boolean waitForPacket(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (closed.get()) {
            return false;
        }
        if (hasBufferedFrame()) {
            return true;
        }
        SelectionKey key = nextReadable(timeout, deadlineOf(timeout));
        if (key == null) {
            return false;
        }
        pendingKey = key;
        return true;
    }

    public boolean hasPendingMessages() {
        return waitForPacket(Duration.ZERO);
    }

    /**
     * Makes a blocked {@link #receive} return {@code false} promptly.
     */
    public void wakeup() {
        selector.wakeup();
    }

    private SelectionKey nextReadable(Duration timeout, long deadline) {
        if (pendingKey != null) {
            SelectionKey key = pendingKey;
            pendingKey = null;
            if (key.isValid()) {
                return key;
            }
        }
        try {
            while (!closed.get()) {
                Iterator<SelectionKey> it = selector.selectedKeys().iterator();
                while (it.hasNext()) {
                    SelectionKey key = it.next();
                    it.remove();
                    if (!key.isValid()) {
                        continue;
                    }
                    if (key.isAcceptable()) {
                        acceptAll();
                    }
                    else if (key.isReadable()) {
                        return key;
                    }
                }

                int ready;
                if (timeout == null) {
                    ready = selector.select();
                }
                else {
                    long remaining = deadline - System.nanoTime();
                    ready = remaining <= 0
                            ? selector.selectNow()
                            : selector.select(Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining)));
                }
                if (ready == 0) {
                    // timed out or woken up
                    return null;
                }
            }
        }
        catch (ClosedSelectorException e) {
            return null;
        }
        catch (IOException e) {
            if (!closed.get()) {
                dispatcher.reportError(OscErrorCode.NETWORK_ERROR,
                        "Selector failure on " + url() + ": " + e.getMessage(), COMPONENT, e);
            }
        }
        return null;
    }

    private void acceptAll() {
        ServerSocketChannel server = (ServerSocketChannel) listenChannel;
        try {
            SocketChannel client;
            while ((client = server.accept()) != null) {
                client.configureBlocking(false);
                if (config.protocol() == OscProtocol.TCP) {
                    client.setOption(StandardSocketOptions.TCP_NODELAY, config.noDelay());
                }
                client.register(selector, SelectionKey.OP_READ, framing.newAssembler());
                connections.add(client);
                log.debug("Accepted OSC connection on {} from {}", url(), remoteOf(client));
            }
        }
        catch (IOException e) {
            dispatcher.reportError(OscErrorCode.SOCKET_ERROR,
                    "Accept failed on " + url() + ": " + e.getMessage(), COMPONENT, e);
        }
    }

    private ReadResult read(SelectionKey key) {
        if (key.channel() instanceof DatagramChannel ch) {
            return readDatagram(ch);
        }
        return readStream(key);
    }

    private ReadResult readDatagram(DatagramChannel ch) {
        datagramBuffer.clear();
        SocketAddress from;
        try {
            from = ch.receive(datagramBuffer);
        }
        catch (IOException e) {
            if (closed.get()) {
                return ReadResult.CLOSED;
            }
            dispatcher.reportError(OscErrorCode.NETWORK_ERROR,
                    "Datagram receive failed on " + url() + ": " + e.getMessage(), COMPONENT, e);
            return ReadResult.FAILED;
        }
        if (from == null) {
            return ReadResult.NOTHING;
        }
        datagramBuffer.flip();
        int size = datagramBuffer.remaining();
        if (size > config.maxMessageSize()) {
            dispatcher.reportError(OscErrorCode.MESSAGE_TOO_LARGE,
                    "Datagram from " + from + " exceeds maximum " + config.maxMessageSize() + " bytes",
                    COMPONENT, null);
            return ReadResult.FAILED;
        }
        byte[] data = new byte[size];
        datagramBuffer.get(data);
        return process(data) ? ReadResult.PACKET : ReadResult.FAILED;
    }

    private ReadResult readStream(SelectionKey key) {
        SocketChannel ch = (SocketChannel) key.channel();
        OscStreamFraming.FrameAssembler assembler = (OscStreamFraming.FrameAssembler) key.attachment();
        int n;
        try {
            n = assembler.readFrom(ch);
        }
        catch (OscException e) {
            dispatcher.reportError(e.code(), "Dropping connection from " + remoteOf(ch) + ": " + e.getMessage(),
                    COMPONENT, e);
            closeConnection(key);
            return ReadResult.FAILED;
        }
        catch (IOException e) {
            if (closed.get()) {
                return ReadResult.CLOSED;
            }
            dispatcher.reportError(OscErrorCode.NETWORK_ERROR,
                    "Read failed from " + remoteOf(ch) + ": " + e.getMessage(), COMPONENT, e);
            closeConnection(key);
            return ReadResult.FAILED;
        }

        if (n < 0) {
            if (assembler.hasPartialFrame()) {
                dispatcher.reportError(OscErrorCode.NETWORK_ERROR,
                        "Connection from " + remoteOf(ch) + " closed mid-frame", COMPONENT, null);
            }
            log.debug("OSC connection from {} closed", remoteOf(ch));
            closeConnection(key);
            return ReadResult.CLOSED;
        }

        Optional<byte[]> frame = assembler.poll();
        if (frame.isEmpty()) {
            return ReadResult.NOTHING;
        }
        return process(frame.get()) ? ReadResult.PACKET : ReadResult.FAILED;
    }

    private boolean process(byte[] data) {
        OscPacket packet;
        try {
            packet = decoder.decode(data);
        }
        catch (OscException e) {
            dispatcher.reportError(e.code(), "Dropping packet of " + data.length + " bytes: " + e.getMessage(),
                    COMPONENT, e);
            return false;
        }
        dispatcher.dispatch(packet);
        return true;
    }

    private Optional<byte[]> pollBufferedFrame() {
        if (!config.protocol().isStream()) {
            return Optional.empty();
        }
        try {
            for (SelectionKey key : selector.keys()) {
                if (key.attachment() instanceof OscStreamFraming.FrameAssembler a && a.hasFrame()) {
                    return a.poll();
                }
            }
        }
        catch (ClosedSelectorException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    private boolean hasBufferedFrame() {
        if (!config.protocol().isStream()) {
            return false;
        }
        try {
            for (SelectionKey key : selector.keys()) {
                if (key.attachment() instanceof OscStreamFraming.FrameAssembler a && a.hasFrame()) {
                    return true;
                }
            }
        }
        catch (ClosedSelectorException e) {
            return false;
        }
        return false;
    }

    private void closeConnection(SelectionKey key) {
        key.cancel();
        connections.remove(key.channel());
        OscAddress.closeQuietly(key.channel());
    }

    // -------------------------------------------------------------------------
    // Accessors and lifecycle
    // -------------------------------------------------------------------------

    public OscProtocol protocol() {
        return config.protocol();
    }

    /**
     * The bound port; for port 0 this is the ephemeral port chosen by the OS.
     * Always 0 for Unix sockets.
     */
    public int port() {
        return boundPort;
    }

    public OscTransportConfig config() {
        return config;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String url() {
        if (config.protocol() == OscProtocol.UNIX) {
            return OscUrl.unix(config.unixPath()).toString();
        }
        return OscUrl.of(config.protocol(), "localhost", boundPort).toString();
    }

    /**
     * Wakes a blocked {@code receive}, closes every channel and removes the
     * Unix socket file this server created.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        selector.wakeup();
        for (SocketChannel ch : connections) {
            OscAddress.closeQuietly(ch);
        }
        connections.clear();
        OscAddress.closeQuietly(listenChannel);
        OscAddress.closeQuietly(selector);
        if (config.protocol() == OscProtocol.UNIX) {
            try {
                Files.deleteIfExists(Path.of(config.unixPath()));
            }
            catch (IOException e) {
                log.warn("Cannot remove Unix socket file {}: {}", config.unixPath(), e.getMessage());
            }
        }
        log.info("OSC server on {} closed", url());
    }

    @Override
    public String toString() {
        return "OscServer[" + url() + "]";
    }

    // -------------------------------------------------------------------------
    // Setup helpers
    // -------------------------------------------------------------------------

    private static SelectableChannel bind(OscTransportConfig config) throws IOException {
        switch (config.protocol()) {
            case UDP: {
                DatagramChannel ch = DatagramChannel.open();
                try {
                    ch.setOption(StandardSocketOptions.SO_REUSEADDR, config.reuseAddress());
                    ch.bind(new InetSocketAddress(config.port()));
                }
                catch (IOException e) {
                    ch.close();
                    throw e;
                }
                return ch;
            }
            case TCP: {
                ServerSocketChannel ch = ServerSocketChannel.open();
                try {
                    ch.setOption(StandardSocketOptions.SO_REUSEADDR, config.reuseAddress());
                    ch.bind(new InetSocketAddress(config.port()));
                }
                catch (IOException e) {
                    ch.close();
                    throw e;
                }
                return ch;
            }
            default: {
                ServerSocketChannel ch = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
                try {
                    ch.bind(UnixDomainSocketAddress.of(config.unixPath()));
                }
                catch (IOException e) {
                    ch.close();
                    throw e;
                }
                return ch;
            }
        }
    }

    private static int localPort(SelectableChannel ch) {
        try {
            SocketAddress local = ch instanceof DatagramChannel d
                    ? d.getLocalAddress()
                    : ((ServerSocketChannel) ch).getLocalAddress();
            return local instanceof InetSocketAddress inet ? inet.getPort() : 0;
        }
        catch (IOException e) {
            throw new OscException(OscErrorCode.SOCKET_ERROR, "Cannot read bound address: " + e.getMessage(), e);
        }
    }

    private static String remoteOf(SocketChannel ch) {
        try {
            SocketAddress remote = ch.getRemoteAddress();
            return remote == null ? "unknown peer" : remote.toString();
        }
        catch (IOException e) {
            return "unknown peer";
        }
    }

    private static String describe(OscTransportConfig config) {
        return config.protocol() == OscProtocol.UNIX
                ? OscProtocol.UNIX.scheme() + " path " + config.unixPath()
                : config.protocol().scheme() + " port " + config.port();
    }

    private static long deadlineOf(Duration timeout) {
        return timeout == null ? 0 : System.nanoTime() + timeout.toNanos();
    }
}
