package com.questrail.osc.codec.impl;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * OscReader
 * -----------------------------------------------------------------------------
 * Bounds-checked big-endian cursor over a region of a byte array.
 *
 * <p>Every read checks the remaining length first. A short read raises
 * {@link OscErrorCode#DESERIALIZATION_ERROR} naming the type tag being read,
 * the bytes it needs and the bytes left, so a truncated packet is always
 * reported precisely instead of surfacing as an index exception.</p>
 *
 * <p>The reader never copies or mutates the underlying array except where a
 * value (blob, string) is materialised.</p>
 */
final class OscReader
{
    private final byte[] data;
    private final int limit;
    private int pos;

    OscReader(byte[] data) {
        this(data, 0, data.length);
    }

    OscReader(byte[] data, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "Region [" + offset + ", " + (offset + length) + ") outside buffer of " + data.length);
        }
        this.data = data;
        this.pos = offset;
        this.limit = offset + length;
    }

    int position() {
        return pos;
    }

    int remaining() {
        return limit - pos;
    }

    boolean hasRemaining() {
        return pos < limit;
    }

    byte peek() {
        return data[pos];
    }

    /** Index of the next NUL byte at or after the cursor, or -1 if none. */
    int indexOfNul() {
        for (int i = pos; i < limit; i++) {
            if (data[i] == 0) {
                return i;
            }
        }
        return -1;
    }

    boolean startsWith(byte[] prefix) {
        if (remaining() < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[pos + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    void skip(int n, char tag) {
        require(n, tag);
        pos += n;
    }

    int readInt32(char tag) {
        require(4, tag);
        int v = ((data[pos] & 0xFF) << 24)
                | ((data[pos + 1] & 0xFF) << 16)
                | ((data[pos + 2] & 0xFF) << 8)
                | (data[pos + 3] & 0xFF);
        pos += 4;
        return v;
    }

    long readInt64(char tag) {
        require(8, tag);
        long hi = readInt32(tag) & 0xFFFF_FFFFL;
        long lo = readInt32(tag) & 0xFFFF_FFFFL;
        return (hi << 32) | lo;
    }

    float readFloat32(char tag) {
        return Float.intBitsToFloat(readInt32(tag));
    }

    double readFloat64(char tag) {
        return Double.longBitsToDouble(readInt64(tag));
    }

    /**
     * Reads a NUL-terminated UTF-8 string and skips its padding.
     *
     * @throws OscException {@code DESERIALIZATION_ERROR} if the terminator or
     *         the padding runs past the end of the region
     */
    String readString(char tag) {
        int nul = indexOfNul();
        if (nul < 0) {
            throw new OscException(OscErrorCode.DESERIALIZATION_ERROR,
                    "Unterminated string for '" + tag + "': " + remaining() + " bytes remaining without NUL");
        }
        int len = nul - pos;
        require(OscWriter.paddedStringLength(len), tag);
        String s = new String(data, pos, len, StandardCharsets.UTF_8);
        pos += OscWriter.paddedStringLength(len);
        return s;
    }

    byte[] readBlob(char tag) {
        int len = readInt32(tag);
        if (len < 0) {
            throw new OscException(OscErrorCode.DESERIALIZATION_ERROR,
                    "Negative blob length for '" + tag + "': " + len);
        }
        require(len, tag);
        int padded = len + OscWriter.padding(len);
        require(padded, tag);
        byte[] out = Arrays.copyOfRange(data, pos, pos + len);
        pos += padded;
        return out;
    }

    byte[] readBytes(int n, char tag) {
        require(n, tag);
        byte[] out = Arrays.copyOfRange(data, pos, pos + n);
        pos += n;
        return out;
    }

    private void require(int n, char tag) {
        if (n > remaining()) {
            throw new OscException(OscErrorCode.DESERIALIZATION_ERROR,
                    "Insufficient data for '" + tag + "': need " + n + " bytes, " + remaining() + " remaining");
        }
    }
}
