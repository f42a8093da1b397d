package com.questrail.osc.codec.impl;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscValue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * OscMessageCodec
 * -----------------------------------------------------------------------------
 * Wire rules for a single OSC message.
 *
 * <pre>
 *   [ path ][ NUL ][ pad to 4 ][ ',' tags ][ NUL ][ pad to 4 ][ arg payloads... ]
 * </pre>
 *
 * <p>Decoding rules, in order:</p>
 * <ol>
 *   <li>the first byte must be {@code '/'} ({@link OscErrorCode#ADDRESS_ERROR})</li>
 *   <li>the path must be NUL-terminated and its padding present
 *       ({@link OscErrorCode#MALFORMED_PACKET})</li>
 *   <li>a message that ends right after the path has no arguments</li>
 *   <li>otherwise the type tag string must start with {@code ','} and be
 *       NUL-terminated ({@link OscErrorCode#MALFORMED_PACKET})</li>
 *   <li>each tag consumes its payload ({@link OscArgumentCodec})</li>
 * </ol>
 *
 * <p>Bytes after the last payload are ignored.</p>
 */
public final class OscMessageCodec
{
    private OscMessageCodec() {}

    public static byte[] encode(OscMessage message)
    {
        Objects.requireNonNull(message, "message");
        OscWriter w = new OscWriter();
        write(w, message);
        return w.toByteArray();
    }

    static void write(OscWriter w, OscMessage message)
    {
        w.writeString(message.path());
        w.writeString("," + message.typeTags());
        for (OscValue v : message.arguments()) {
            OscArgumentCodec.write(w, v);
        }
    }

    public static OscMessage decode(byte[] data, int offset, int length)
    {
        Objects.requireNonNull(data, "data");
        OscReader r = new OscReader(data, offset, length);

        if (!r.hasRemaining()) {
            throw new OscException(OscErrorCode.MALFORMED_PACKET, "Empty OSC message");
        }
        if (r.peek() != '/') {
            throw new OscException(OscErrorCode.ADDRESS_ERROR,
                    "OSC address must start with '/' (first byte 0x"
                            + String.format("%02X", r.peek() & 0xFF) + ")");
        }

        String path = readPaddedString(r, "address");
        if (!r.hasRemaining()) {
            return new OscMessage(path, List.of());
        }

        if (r.peek() != ',') {
            throw new OscException(OscErrorCode.MALFORMED_PACKET,
                    "Type tag string must start with ',' in message " + path);
        }
        String tags = readPaddedString(r, "type tag string").substring(1);

        return new OscMessage(path, OscArgumentCodec.readArguments(r, tags));
    }

    private static String readPaddedString(OscReader r, String what)
    {
        int nul = r.indexOfNul();
        if (nul < 0) {
            throw new OscException(OscErrorCode.MALFORMED_PACKET,
                    "Missing NUL terminator for " + what);
        }
        int len = nul - r.position();
        int padded = OscWriter.paddedStringLength(len);
        if (padded > r.remaining()) {
            throw new OscException(OscErrorCode.MALFORMED_PACKET,
                    "Truncated padding for " + what + ": need " + padded + " bytes, " + r.remaining() + " remaining");
        }
        byte[] raw = r.readBytes(len, 's');
        r.skip(padded - len, 's');
        return new String(raw, StandardCharsets.UTF_8);
    }
}
