package com.questrail.osc.codec.impl;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.model.OscTimeTag;
import com.questrail.osc.model.OscValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OscArgumentCodec
 * -----------------------------------------------------------------------------
 * Per-type wire rules for OSC arguments.
 *
 * <pre>
 *   i  int32            4 bytes
 *   h  int64            8 bytes
 *   f  float32          4 bytes IEEE-754
 *   d  float64          8 bytes IEEE-754
 *   s  string           UTF-8 + NUL, padded to 4
 *   S  symbol           as 's'
 *   b  blob             int32 size + bytes, padded to 4
 *   t  time tag         uint32 seconds + uint32 fraction
 *   c  char             int32 character code
 *   r  RGBA colour      uint32, red in the most significant byte
 *   m  MIDI             port, status, data1, data2 (4 raw bytes)
 *   T F N I             no payload
 *   [ ]                 no payload; delimit a nested array
 * </pre>
 *
 * <p>Decoding walks a type tag string (without its leading comma) and consumes
 * one payload per tag. Bracket balance is checked here; an unknown tag is a
 * {@link OscErrorCode#MALFORMED_PACKET}.</p>
 */
public final class OscArgumentCodec
{
    /** Deepest array nesting accepted while decoding. */
    static final int MAX_ARRAY_DEPTH = 64;

    private OscArgumentCodec() {}

    /**
     * Returns the exact payload bytes of {@code value} (no type tag).
     */
    public static byte[] encode(OscValue value)
    {
        Objects.requireNonNull(value, "value");
        OscWriter w = new OscWriter();
        write(w, value);
        return w.toByteArray();
    }

    /**
     * Decodes a single value given its full type tag text (for arrays this is
     * the bracketed form returned by {@link OscValue#typeTags()}).
     */
    public static OscValue decode(String typeTags, byte[] payload)
    {
        Objects.requireNonNull(typeTags, "typeTags");
        Objects.requireNonNull(payload, "payload");
        List<OscValue> values = readArguments(new OscReader(payload), typeTags);
        if (values.size() != 1) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "Type tags '" + typeTags + "' describe " + values.size() + " values, expected 1");
        }
        return values.get(0);
    }

    static void write(OscWriter w, OscValue value)
    {
        if (value instanceof OscValue.Int32 v) {
            w.writeInt32(v.value());
        }
        else if (value instanceof OscValue.Int64 v) {
            w.writeInt64(v.value());
        }
        else if (value instanceof OscValue.Float32 v) {
            w.writeFloat32(v.value());
        }
        else if (value instanceof OscValue.Float64 v) {
            w.writeFloat64(v.value());
        }
        else if (value instanceof OscValue.Str v) {
            w.writeString(v.value());
        }
        else if (value instanceof OscValue.Symbol v) {
            w.writeString(v.value());
        }
        else if (value instanceof OscValue.Blob v) {
            w.writeBlob(v.bytes());
        }
        else if (value instanceof OscValue.Time v) {
            writeTimeTag(w, v.value());
        }
        else if (value instanceof OscValue.Char v) {
            w.writeInt32(v.value());
        }
        else if (value instanceof OscValue.Color v) {
            w.writeInt32(v.rgba());
        }
        else if (value instanceof OscValue.Midi v) {
            w.writeBytes(new byte[] {
                    (byte) v.port(), (byte) v.status(), (byte) v.data1(), (byte) v.data2() });
        }
        else if (value instanceof OscValue.Array v) {
            for (OscValue element : v.elements()) {
                write(w, element);
            }
        }
        // Bool, Nil and Infinitum carry no payload
    }

    static void writeTimeTag(OscWriter w, OscTimeTag tag)
    {
        w.writeInt32((int) tag.seconds());
        w.writeInt32((int) tag.fraction());
    }

    static OscTimeTag readTimeTag(OscReader r, char tag)
    {
        long seconds = r.readInt32(tag) & 0xFFFF_FFFFL;
        long fraction = r.readInt32(tag) & 0xFFFF_FFFFL;
        return new OscTimeTag(seconds, fraction);
    }

    /**
     * Reads every argument described by {@code tags} (no leading comma).
     */
    static List<OscValue> readArguments(OscReader r, String tags)
    {
        return readSequence(r, tags, new int[] {0}, 0);
    }

    private static List<OscValue> readSequence(OscReader r, String tags, int[] cursor, int depth)
    {
        List<OscValue> out = new ArrayList<>();
        while (cursor[0] < tags.length()) {
            char tag = tags.charAt(cursor[0]++);
            if (tag == OscValue.ARRAY_END_TAG) {
                if (depth == 0) {
                    throw new OscException(OscErrorCode.MALFORMED_PACKET,
                            "Unbalanced ']' at type tag index " + (cursor[0] - 1) + " in '" + tags + "'");
                }
                return out;
            }
            if (tag == OscValue.ARRAY_BEGIN_TAG) {
                if (depth + 1 > MAX_ARRAY_DEPTH) {
                    throw new OscException(OscErrorCode.MALFORMED_PACKET,
                            "Array nesting deeper than " + MAX_ARRAY_DEPTH);
                }
                out.add(OscValue.array(readSequence(r, tags, cursor, depth + 1)));
            }
            else {
                out.add(readValue(r, tag));
            }
        }
        if (depth > 0) {
            throw new OscException(OscErrorCode.MALFORMED_PACKET,
                    "Unterminated '[' in type tags '" + tags + "'");
        }
        return out;
    }

    private static OscValue readValue(OscReader r, char tag)
    {
        switch (tag) {
            case OscValue.INT32_TAG:
                return OscValue.int32(r.readInt32(tag));
            case OscValue.INT64_TAG:
                return OscValue.int64(r.readInt64(tag));
            case OscValue.FLOAT_TAG:
                return OscValue.float32(r.readFloat32(tag));
            case OscValue.DOUBLE_TAG:
                return OscValue.float64(r.readFloat64(tag));
            case OscValue.STRING_TAG:
                return OscValue.string(r.readString(tag));
            case OscValue.SYMBOL_TAG:
                return OscValue.symbol(r.readString(tag));
            case OscValue.BLOB_TAG:
                return OscValue.blob(r.readBlob(tag));
            case OscValue.TIMETAG_TAG:
                return OscValue.timeTag(readTimeTag(r, tag));
            case OscValue.CHAR_TAG:
                return OscValue.character((char) r.readInt32(tag));
            case OscValue.RGBA_TAG:
                return OscValue.color(r.readInt32(tag));
            case OscValue.MIDI_TAG: {
                byte[] m = r.readBytes(4, tag);
                return OscValue.midi(m[0] & 0xFF, m[1] & 0xFF, m[2] & 0xFF, m[3] & 0xFF);
            }
            case OscValue.TRUE_TAG:
                return OscValue.bool(true);
            case OscValue.FALSE_TAG:
                return OscValue.bool(false);
            case OscValue.NIL_TAG:
                return OscValue.nil();
            case OscValue.INFINITUM_TAG:
                return OscValue.infinitum();
            default:
                throw new OscException(OscErrorCode.MALFORMED_PACKET,
                        "Unknown type tag '" + tag + "'");
        }
    }
}
