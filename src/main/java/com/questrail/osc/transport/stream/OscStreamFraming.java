package com.questrail.osc.transport.stream;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * OscStreamFraming
 * -----------------------------------------------------------------------------
 * Length-prefix framing for OSC over byte streams (TCP, Unix-domain sockets).
 *
 * <pre>
 *   [ uint32 length, big-endian ][ length bytes of OSC packet ]
 * </pre>
 *
 * <p>Declared lengths are checked before any payload is read:</p>
 * <ul>
 *   <li>above {@code maxFrameSize}: {@link OscErrorCode#MESSAGE_TOO_LARGE}</li>
 *   <li>below {@code minFrameSize}: {@link OscErrorCode#MALFORMED_PACKET}</li>
 * </ul>
 *
 * <p>{@link #receiveFramed(ReadableByteChannel)} reads one whole frame from a
 * channel that is normally blocking. A read that returns zero bytes is retried
 * up to {@code maxRetries} times with a short back-off before the frame is
 * abandoned. Non-blocking readers driven by a selector use
 * {@link FrameAssembler} instead, which keeps partial frames between reads.</p>
 */
public final class OscStreamFraming
{
    public static final int HEADER_SIZE = 4;

    /** Smallest possible OSC packet: a 4-byte path plus a 4-byte type tag string. */
    public static final int MIN_OSC_PACKET_SIZE = 8;

    public static final int DEFAULT_MAX_RETRIES = 3;

    private static final long RETRY_BACKOFF_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final int maxFrameSize;
    private final int minFrameSize;
    private final int maxRetries;

    public OscStreamFraming(int maxFrameSize, int minFrameSize, int maxRetries)
    {
        if (maxFrameSize < 0 || minFrameSize < 0 || minFrameSize > maxFrameSize) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "Frame size bounds must satisfy 0 <= min <= max (min=" + minFrameSize + ", max=" + maxFrameSize + ")");
        }
        if (maxRetries < 0) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT, "maxRetries must be >= 0 (was " + maxRetries + ")");
        }
        this.maxFrameSize = maxFrameSize;
        this.minFrameSize = minFrameSize;
        this.maxRetries = maxRetries;
    }

    /**
     * Framing for OSC packets: frames shorter than 8 bytes are rejected.
     */
    public static OscStreamFraming forOsc(int maxFrameSize)
    {
        return new OscStreamFraming(maxFrameSize, MIN_OSC_PACKET_SIZE, DEFAULT_MAX_RETRIES);
    }

    /**
     * Framing for arbitrary payloads, empty frames included.
     */
    public static OscStreamFraming raw(int maxFrameSize)
    {
        return new OscStreamFraming(maxFrameSize, 0, DEFAULT_MAX_RETRIES);
    }

    public int maxFrameSize() {
        return maxFrameSize;
    }

    public int minFrameSize() {
        return minFrameSize;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Returns the 4-byte length prefix followed by {@code payload}.
     */
    public byte[] encode(byte[] payload)
    {
        checkOutbound(payload);
        return ByteBuffer.allocate(HEADER_SIZE + payload.length)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    /**
     * Writes the length prefix and then the payload, verifying that every byte
     * of each was transferred.
     *
     * @throws OscException {@link OscErrorCode#NETWORK_ERROR} if the channel
     *         stops accepting bytes
     */
    public void sendFramed(WritableByteChannel channel, byte[] payload) throws IOException
    {
        checkOutbound(payload);
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).putInt(payload.length);
        header.flip();
        writeFully(channel, header, "length prefix");
        writeFully(channel, ByteBuffer.wrap(payload), "payload");
    }

    /**
     * Reads one complete frame.
     *
     * @return the payload, or empty if the peer closed the stream cleanly
     *         before the first length byte
     * @throws OscException {@link OscErrorCode#MESSAGE_TOO_LARGE},
     *         {@link OscErrorCode#MALFORMED_PACKET} for an out-of-range length,
     *         {@link OscErrorCode#NETWORK_ERROR} for a close or stall mid-frame
     */
    public Optional<byte[]> receiveFramed(ReadableByteChannel channel) throws IOException
    {
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        if (!readFully(channel, header, true)) {
            return Optional.empty();
        }
        header.flip();
        int length = checkInbound(header.getInt());

        ByteBuffer payload = ByteBuffer.allocate(length);
        readFully(channel, payload, false);
        return Optional.of(payload.array());
    }

    /**
     * Creates an incremental decoder for a non-blocking stream.
     */
    public FrameAssembler newAssembler()
    {
        return new FrameAssembler();
    }

    private void checkOutbound(byte[] payload)
    {
        if (payload == null) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT, "payload must not be null");
        }
        if (payload.length > maxFrameSize) {
            throw new OscException(OscErrorCode.MESSAGE_TOO_LARGE,
                    "Frame payload of " + payload.length + " bytes exceeds maximum " + maxFrameSize);
        }
    }

    private int checkInbound(int declared)
    {
        long length = declared & 0xFFFF_FFFFL;
        if (length > maxFrameSize) {
            throw new OscException(OscErrorCode.MESSAGE_TOO_LARGE,
                    "Declared frame length " + length + " exceeds maximum " + maxFrameSize);
        }
        if (length < minFrameSize) {
            throw new OscException(OscErrorCode.MALFORMED_PACKET,
                    "Declared frame length " + length + " below minimum " + minFrameSize);
        }
        return (int) length;
    }

    private void writeFully(WritableByteChannel channel, ByteBuffer buf, String what) throws IOException
    {
        int stalls = 0;
        while (buf.hasRemaining()) {
            int expected = buf.remaining();
            int written = channel.write(buf);
            if (written == expected) {
                return;
            }
            if (written == 0 && ++stalls > maxRetries) {
                throw new OscException(OscErrorCode.NETWORK_ERROR,
                        "Short write of frame " + what + ": " + buf.remaining() + " bytes not sent");
            }
            if (written == 0) {
                LockSupport.parkNanos(RETRY_BACKOFF_NANOS * stalls);
            }
        }
    }

    /**
     * @return false only when {@code eofAllowedAtStart} and the stream ended
     *         before any byte was read
     */
    private boolean readFully(ReadableByteChannel channel, ByteBuffer buf, boolean eofAllowedAtStart)
            throws IOException
    {
        int stalls = 0;
        while (buf.hasRemaining()) {
            int n = channel.read(buf);
            if (n < 0) {
                if (eofAllowedAtStart && buf.position() == 0) {
                    return false;
                }
                throw new OscException(OscErrorCode.NETWORK_ERROR,
                        "Connection closed mid-frame: " + buf.remaining() + " of " + buf.capacity() + " bytes missing");
            }
            if (n == 0) {
                if (++stalls > maxRetries) {
                    throw new OscException(OscErrorCode.NETWORK_ERROR,
                            "No progress reading frame after " + maxRetries + " retries: "
                                    + buf.remaining() + " of " + buf.capacity() + " bytes missing");
                }
                LockSupport.parkNanos(RETRY_BACKOFF_NANOS * stalls);
            }
            else {
                stalls = 0;
            }
        }
        return true;
    }

    /**
     * FrameAssembler
     * -------------------------------------------------------------------------
     * Incremental frame decoder for one non-blocking connection.
     *
     * <p>{@link #readFrom(ReadableByteChannel)} appends whatever bytes are
     * available; {@link #poll()} returns the next complete frame. Several
     * frames may be buffered by a single read. Not thread-safe.</p>
     */
    public final class FrameAssembler
    {
        private final ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        private ByteBuffer body;
        private final ArrayDeque<byte[]> complete = new ArrayDeque<>();

        private FrameAssembler() {}

        /**
         * Reads available bytes and assembles as many frames as they complete.
         *
         * @return bytes read, or -1 if the peer closed the stream
         * @throws OscException if a declared length is out of range; the
         *         stream cannot be resynchronised after this
         */
        public int readFrom(ReadableByteChannel channel) throws IOException
        {
            ByteBuffer chunk = ByteBuffer.allocate(8192);
            int total = 0;
            while (true) {
                chunk.clear();
                int n = channel.read(chunk);
                if (n < 0) {
                    return total > 0 ? total : -1;
                }
                if (n == 0) {
                    return total;
                }
                total += n;
                chunk.flip();
                consume(chunk);
            }
        }

        void consume(ByteBuffer chunk)
        {
            while (chunk.hasRemaining()) {
                if (body == null) {
                    transfer(chunk, header);
                    if (header.hasRemaining()) {
                        return;
                    }
                    header.flip();
                    int length = checkInbound(header.getInt());
                    header.clear();
                    body = ByteBuffer.allocate(length);
                }
                transfer(chunk, body);
                if (!body.hasRemaining()) {
                    complete.add(body.array());
                    body = null;
                }
            }
        }

        public Optional<byte[]> poll()
        {
            return Optional.ofNullable(complete.poll());
        }

        public boolean hasFrame()
        {
            return !complete.isEmpty();
        }

        /**
         * True while a frame has been started but not completed.
         */
        public boolean hasPartialFrame()
        {
            return body != null || header.position() > 0;
        }

        private void transfer(ByteBuffer from, ByteBuffer to)
        {
            int n = Math.min(from.remaining(), to.remaining());
            if (n > 0) {
                to.put(to.position(), from, from.position(), n);
                to.position(to.position() + n);
                from.position(from.position() + n);
            }
        }
    }
}
