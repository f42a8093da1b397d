package com.questrail.osc.codec.impl;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.model.OscBundle;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscPacket;
import com.questrail.osc.model.OscTimeTag;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OscBundleCodec
 * -----------------------------------------------------------------------------
 * Wire rules for OSC bundles.
 *
 * <pre>
 *   "#bundle\0"           8 bytes
 *   time tag              8 bytes (seconds, fraction)
 *   { int32 size, element bytes }*
 * </pre>
 *
 * <p>Elements are encoded in list order. While decoding, an element whose
 * first seven bytes read {@code #bundle} is decoded as a nested bundle;
 * everything else is decoded as a message.</p>
 *
 * <p>Structural faults are {@link OscErrorCode#MALFORMED_PACKET}:</p>
 * <ul>
 *   <li>fewer than 16 bytes, or missing magic</li>
 *   <li>an element size of zero, above the remaining bytes, or below 8</li>
 *   <li>nesting deeper than the configured bound</li>
 * </ul>
 *
 * <p>A failure inside an element is re-thrown with its index as context and
 * with its original code. Trailing bytes shorter than a size word are ignored.</p>
 */
public final class OscBundleCodec
{
    /** Default bound on bundle nesting accepted while decoding. */
    public static final int DEFAULT_MAX_DEPTH = 64;

    static final byte[] MAGIC = "#bundle\0".getBytes(StandardCharsets.US_ASCII);
    static final byte[] MAGIC_PREFIX = "#bundle".getBytes(StandardCharsets.US_ASCII);

    static final int HEADER_SIZE = 16;
    static final int MIN_ELEMENT_SIZE = 8;

    private OscBundleCodec() {}

    public static byte[] encode(OscBundle bundle)
    {
        Objects.requireNonNull(bundle, "bundle");
        OscWriter w = new OscWriter(HEADER_SIZE + 64 * bundle.size());
        write(w, bundle);
        return w.toByteArray();
    }

    static void write(OscWriter w, OscBundle bundle)
    {
        w.writeBytes(MAGIC);
        OscArgumentCodec.writeTimeTag(w, bundle.timeTag());

        List<OscPacket> elements = bundle.elements();
        for (int i = 0; i < elements.size(); i++) {
            byte[] element;
            try {
                element = encodeElement(elements.get(i));
            }
            catch (OscException e) {
                throw e.withContext("in bundle element " + i);
            }
            w.writeInt32(element.length);
            w.writeBytes(element);
        }
    }

    private static byte[] encodeElement(OscPacket packet)
    {
        OscWriter w = new OscWriter();
        if (packet instanceof OscMessage m) {
            OscMessageCodec.write(w, m);
        }
        else {
            write(w, (OscBundle) packet);
        }
        return w.toByteArray();
    }

    /**
     * Returns true when the region begins with the 7-byte {@code #bundle} prefix.
     */
    public static boolean isBundle(byte[] data, int offset, int length)
    {
        return length >= MAGIC_PREFIX.length
                && new OscReader(data, offset, length).startsWith(MAGIC_PREFIX);
    }

    public static OscBundle decode(byte[] data, int offset, int length)
    {
        return decode(data, offset, length, DEFAULT_MAX_DEPTH);
    }

    public static OscBundle decode(byte[] data, int offset, int length, int maxDepth)
    {
        Objects.requireNonNull(data, "data");
        return decode(data, offset, length, 0, maxDepth);
    }

    private static OscBundle decode(byte[] data, int offset, int length, int depth, int maxDepth)
    {
        if (length < HEADER_SIZE) {
            throw new OscException(OscErrorCode.MALFORMED_PACKET,
                    "Bundle too short: " + length + " bytes, need at least " + HEADER_SIZE);
        }
        OscReader r = new OscReader(data, offset, length);
        if (!r.startsWith(MAGIC)) {
            throw new OscException(OscErrorCode.MALFORMED_PACKET, "Missing '#bundle' header");
        }
        r.skip(MAGIC.length, '#');
        OscTimeTag timeTag = OscArgumentCodec.readTimeTag(r, 't');

        List<OscPacket> elements = new ArrayList<>();
        int index = 0;
        while (r.remaining() >= 4) {
            int size = r.readInt32('#');
            if (size == 0) {
                throw new OscException(OscErrorCode.MALFORMED_PACKET,
                        "Zero-size bundle element at index " + index);
            }
            if (size < 0 || size > r.remaining()) {
                throw new OscException(OscErrorCode.MALFORMED_PACKET,
                        "Bundle element " + index + " declares " + (size & 0xFFFF_FFFFL)
                                + " bytes, " + r.remaining() + " remaining");
            }
            if (size < MIN_ELEMENT_SIZE) {
                throw new OscException(OscErrorCode.MALFORMED_PACKET,
                        "Bundle element " + index + " too small: " + size + " bytes");
            }

            int start = r.position();
            try {
                if (isBundle(data, start, size)) {
                    if (depth + 1 > maxDepth) {
                        throw new OscException(OscErrorCode.MALFORMED_PACKET,
                                "Bundle nesting deeper than " + maxDepth);
                    }
                    elements.add(decode(data, start, size, depth + 1, maxDepth));
                }
                else {
                    elements.add(OscMessageCodec.decode(data, start, size));
                }
            }
            catch (OscException e) {
                throw e.withContext("in bundle element " + index);
            }

            r.skip(size, '#');
            index++;
        }

        return new OscBundle(timeTag, elements);
    }
}
