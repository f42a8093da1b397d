package com.questrail.osc.codec.impl;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * OscWriter
 * -----------------------------------------------------------------------------
 * Growable big-endian byte sink used by the OSC encoders.
 *
 * <p>Every multi-byte numeric field is written most significant byte first.
 * Strings and blobs are zero-padded so that their own encoded length is a
 * multiple of four; fixed-width fields are already aligned.</p>
 */
final class OscWriter
{
    private byte[] buf;
    private int size;

    OscWriter() {
        this(64);
    }

    OscWriter(int initialCapacity) {
        this.buf = new byte[Math.max(16, initialCapacity)];
    }

    int size() {
        return size;
    }

    OscWriter writeInt32(int v) {
        ensure(4);
        buf[size++] = (byte) (v >>> 24);
        buf[size++] = (byte) (v >>> 16);
        buf[size++] = (byte) (v >>> 8);
        buf[size++] = (byte) v;
        return this;
    }

    OscWriter writeInt64(long v) {
        writeInt32((int) (v >>> 32));
        writeInt32((int) v);
        return this;
    }

    OscWriter writeFloat32(float v) {
        return writeInt32(Float.floatToRawIntBits(v));
    }

    OscWriter writeFloat64(double v) {
        return writeInt64(Double.doubleToRawLongBits(v));
    }

    /**
     * Writes {@code s} as UTF-8, a NUL terminator, then zero padding up to the
     * next 4-byte boundary (at least one NUL is always written).
     */
    OscWriter writeString(String s) {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        writeBytes(utf8);
        int padded = paddedStringLength(utf8.length);
        writeZeros(padded - utf8.length);
        return this;
    }

    /**
     * Writes an int32 byte count, the bytes, then zero padding to 4.
     */
    OscWriter writeBlob(byte[] data) {
        writeInt32(data.length);
        writeBytes(data);
        writeZeros(padding(data.length));
        return this;
    }

    OscWriter writeBytes(byte[] data) {
        ensure(data.length);
        System.arraycopy(data, 0, buf, size, data.length);
        size += data.length;
        return this;
    }

    OscWriter writeZeros(int n) {
        ensure(n);
        // buffer slack is always zero: bytes are never un-written
        size += n;
        return this;
    }

    byte[] toByteArray() {
        return Arrays.copyOf(buf, size);
    }

    /** Number of zero bytes needed to bring {@code length} to a multiple of 4. */
    static int padding(int length) {
        return (4 - (length & 3)) & 3;
    }

    /** Encoded length of a string of {@code utf8Length} bytes including its NUL and padding. */
    static int paddedStringLength(int utf8Length) {
        return (utf8Length + 4) & ~3;
    }

    private void ensure(int extra) {
        int needed = size + extra;
        if (needed > buf.length) {
            buf = Arrays.copyOf(buf, Math.max(needed, buf.length * 2));
        }
    }
}
