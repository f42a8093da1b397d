package com.questrail.osc.model;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.codec.impl.OscArgumentCodec;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One OSC argument.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code OscValue} is a closed tagged union covering every OSC 1.0 and 1.1
 * argument type. Each variant is a record and maps to exactly one type tag
 * character:
 * </p>
 *
 * <pre>
 *   Int32 'i'   Int64 'h'   Float32 'f'   Float64 'd'
 *   Str 's'     Symbol 'S'  Blob 'b'      Time 't'
 *   Char 'c'    Color 'r'   Midi 'm'      Bool 'T' / 'F'
 *   Nil 'N'     Infinitum 'I'             Array '[' ... ']'
 * </pre>
 *
 * <h2>Typed access</h2>
 * <p>
 * The {@code asXxx()} accessors never coerce. Calling an accessor on the wrong
 * variant throws {@link OscException} with {@link OscErrorCode#TYPE_MISMATCH},
 * naming the expected and the actual type.
 * </p>
 *
 * <h2>Wire form</h2>
 * <p>
 * {@link #serialize()} returns the exact payload bytes of the value, padding
 * included. Wire mechanics live in the codec layer; this type only describes
 * the value.
 * </p>
 */
public sealed interface OscValue
        permits OscValue.Int32, OscValue.Int64, OscValue.Float32, OscValue.Float64,
                OscValue.Str, OscValue.Symbol, OscValue.Blob, OscValue.Time,
                OscValue.Char, OscValue.Color, OscValue.Midi, OscValue.Bool,
                OscValue.Nil, OscValue.Infinitum, OscValue.Array
{
    char INT32_TAG = 'i';
    char INT64_TAG = 'h';
    char FLOAT_TAG = 'f';
    char DOUBLE_TAG = 'd';
    char STRING_TAG = 's';
    char SYMBOL_TAG = 'S';
    char BLOB_TAG = 'b';
    char TIMETAG_TAG = 't';
    char CHAR_TAG = 'c';
    char RGBA_TAG = 'r';
    char MIDI_TAG = 'm';
    char TRUE_TAG = 'T';
    char FALSE_TAG = 'F';
    char NIL_TAG = 'N';
    char INFINITUM_TAG = 'I';
    char ARRAY_BEGIN_TAG = '[';
    char ARRAY_END_TAG = ']';

    /**
     * The single wire type tag character of this value ({@code '['} for arrays).
     */
    char typeTag();

    /**
     * Human-readable type name used in diagnostics.
     */
    String typeName();

    /**
     * Full type tag text of this value. Identical to {@link #typeTag()} except
     * for arrays, which render as {@code '['} + element tags + {@code ']'}.
     */
    default String typeTags() {
        return String.valueOf(typeTag());
    }

    /**
     * Exact wire payload of this value (without its type tag).
     */
    default byte[] serialize() {
        return OscArgumentCodec.encode(this);
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    static OscValue int32(int value) { return new Int32(value); }

    static OscValue int64(long value) { return new Int64(value); }

    static OscValue float32(float value) { return new Float32(value); }

    static OscValue float64(double value) { return new Float64(value); }

    static OscValue string(String value) { return new Str(value); }

    static OscValue symbol(String value) { return new Symbol(value); }

    static OscValue blob(byte[] bytes) { return new Blob(bytes); }

    static OscValue timeTag(OscTimeTag value) { return new Time(value); }

    static OscValue character(char value) { return new Char(value); }

    static OscValue color(int rgba) { return new Color(rgba); }

    static OscValue color(int red, int green, int blue, int alpha) {
        return Color.of(red, green, blue, alpha);
    }

    static OscValue midi(int port, int status, int data1, int data2) {
        return new Midi(port, status, data1, data2);
    }

    static OscValue bool(boolean value) { return value ? Bool.TRUE : Bool.FALSE; }

    static OscValue nil() { return Nil.INSTANCE; }

    static OscValue infinitum() { return Infinitum.INSTANCE; }

    static OscValue array(List<OscValue> elements) { return new Array(elements); }

    static OscValue array(OscValue... elements) { return new Array(List.of(elements)); }

    // -------------------------------------------------------------------------
    // Type predicates
    // -------------------------------------------------------------------------

    default boolean isInt32() { return this instanceof Int32; }

    default boolean isInt64() { return this instanceof Int64; }

    default boolean isFloat() { return this instanceof Float32; }

    default boolean isDouble() { return this instanceof Float64; }

    default boolean isString() { return this instanceof Str; }

    default boolean isSymbol() { return this instanceof Symbol; }

    default boolean isBlob() { return this instanceof Blob; }

    default boolean isTimeTag() { return this instanceof Time; }

    default boolean isChar() { return this instanceof Char; }

    default boolean isColor() { return this instanceof Color; }

    default boolean isMidi() { return this instanceof Midi; }

    default boolean isBool() { return this instanceof Bool; }

    default boolean isTrue() { return this instanceof Bool b && b.value(); }

    default boolean isFalse() { return this instanceof Bool b && !b.value(); }

    default boolean isNil() { return this instanceof Nil; }

    default boolean isInfinitum() { return this instanceof Infinitum; }

    default boolean isArray() { return this instanceof Array; }

    // -------------------------------------------------------------------------
    // Typed accessors (no coercion)
    // -------------------------------------------------------------------------

    default int asInt32() { throw mismatch("int32", this); }

    default long asInt64() { throw mismatch("int64", this); }

    default float asFloat() { throw mismatch("float32", this); }

    default double asDouble() { throw mismatch("float64", this); }

    default String asString() { throw mismatch("string", this); }

    default String asSymbol() { throw mismatch("symbol", this); }

    default byte[] asBlob() { throw mismatch("blob", this); }

    default OscTimeTag asTimeTag() { throw mismatch("timetag", this); }

    default char asChar() { throw mismatch("char", this); }

    default Color asColor() { throw mismatch("color", this); }

    default Midi asMidi() { throw mismatch("midi", this); }

    default boolean asBool() { throw mismatch("bool", this); }

    default List<OscValue> asArray() { throw mismatch("array", this); }

    private static OscException mismatch(String expected, OscValue actual) {
        return new OscException(OscErrorCode.TYPE_MISMATCH,
                "Expected " + expected + " but value is " + actual.typeName()
                        + " ('" + actual.typeTag() + "')");
    }

    // -------------------------------------------------------------------------
    // Variants
    // -------------------------------------------------------------------------

    record Int32(int value) implements OscValue {
        @Override public char typeTag() { return INT32_TAG; }
        @Override public String typeName() { return "int32"; }
        @Override public int asInt32() { return value; }
    }

    record Int64(long value) implements OscValue {
        @Override public char typeTag() { return INT64_TAG; }
        @Override public String typeName() { return "int64"; }
        @Override public long asInt64() { return value; }
    }

    record Float32(float value) implements OscValue {
        @Override public char typeTag() { return FLOAT_TAG; }
        @Override public String typeName() { return "float32"; }
        @Override public float asFloat() { return value; }
    }

    record Float64(double value) implements OscValue {
        @Override public char typeTag() { return DOUBLE_TAG; }
        @Override public String typeName() { return "float64"; }
        @Override public double asDouble() { return value; }
    }

    record Str(String value) implements OscValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override public char typeTag() { return STRING_TAG; }
        @Override public String typeName() { return "string"; }
        @Override public String asString() { return value; }
    }

    /**
     * Alternate string type. Same wire layout as {@link Str}, different tag.
     */
    record Symbol(String value) implements OscValue {
        public Symbol {
            Objects.requireNonNull(value, "value");
        }

        @Override public char typeTag() { return SYMBOL_TAG; }
        @Override public String typeName() { return "symbol"; }
        @Override public String asSymbol() { return value; }
    }

    /**
     * Binary payload. The array is copied on the way in and on the way out.
     */
    record Blob(byte[] bytes) implements OscValue {
        public Blob {
            bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        @Override public byte[] bytes() { return bytes.clone(); }

        public int size() { return bytes.length; }

        @Override public char typeTag() { return BLOB_TAG; }
        @Override public String typeName() { return "blob"; }
        @Override public byte[] asBlob() { return bytes.clone(); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Blob that)) return false;
            return Arrays.equals(bytes, that.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Blob[" + bytes.length + " bytes]";
        }
    }

    record Time(OscTimeTag value) implements OscValue {
        public Time {
            Objects.requireNonNull(value, "value");
        }

        @Override public char typeTag() { return TIMETAG_TAG; }
        @Override public String typeName() { return "timetag"; }
        @Override public OscTimeTag asTimeTag() { return value; }
    }

    /**
     * Single character, carried as an int32 on the wire.
     */
    record Char(char value) implements OscValue {
        @Override public char typeTag() { return CHAR_TAG; }
        @Override public String typeName() { return "char"; }
        @Override public char asChar() { return value; }
    }

    /**
     * RGBA colour packed as {@code 0xRRGGBBAA}.
     */
    record Color(int rgba) implements OscValue {
        public static Color of(int red, int green, int blue, int alpha) {
            return new Color((checkByte(red, "red") << 24)
                    | (checkByte(green, "green") << 16)
                    | (checkByte(blue, "blue") << 8)
                    | checkByte(alpha, "alpha"));
        }

        public int red() { return (rgba >>> 24) & 0xFF; }
        public int green() { return (rgba >>> 16) & 0xFF; }
        public int blue() { return (rgba >>> 8) & 0xFF; }
        public int alpha() { return rgba & 0xFF; }

        @Override public char typeTag() { return RGBA_TAG; }
        @Override public String typeName() { return "color"; }
        @Override public Color asColor() { return this; }

        @Override
        public String toString() {
            return String.format("Color[#%08X]", rgba);
        }
    }

    /**
     * Four raw MIDI bytes: port id, status byte, data1, data2.
     */
    record Midi(int port, int status, int data1, int data2) implements OscValue {
        public Midi {
            checkByte(port, "port");
            checkByte(status, "status");
            checkByte(data1, "data1");
            checkByte(data2, "data2");
        }

        @Override public char typeTag() { return MIDI_TAG; }
        @Override public String typeName() { return "midi"; }
        @Override public Midi asMidi() { return this; }
    }

    /**
     * Boolean carried entirely in the type tag ({@code T} or {@code F}).
     */
    record Bool(boolean value) implements OscValue {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override public char typeTag() { return value ? TRUE_TAG : FALSE_TAG; }
        @Override public String typeName() { return "bool"; }
        @Override public boolean asBool() { return value; }
    }

    record Nil() implements OscValue {
        static final Nil INSTANCE = new Nil();

        @Override public char typeTag() { return NIL_TAG; }
        @Override public String typeName() { return "nil"; }
    }

    record Infinitum() implements OscValue {
        static final Infinitum INSTANCE = new Infinitum();

        @Override public char typeTag() { return INFINITUM_TAG; }
        @Override public String typeName() { return "infinitum"; }
    }

    /**
     * Ordered, nestable sequence of values. Brackets carry no payload bytes.
     */
    record Array(List<OscValue> elements) implements OscValue {
        public Array {
            elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        }

        @Override public char typeTag() { return ARRAY_BEGIN_TAG; }
        @Override public String typeName() { return "array"; }
        @Override public List<OscValue> asArray() { return elements; }

        @Override
        public String typeTags() {
            StringBuilder sb = new StringBuilder().append(ARRAY_BEGIN_TAG);
            for (OscValue element : elements) {
                sb.append(element.typeTags());
            }
            return sb.append(ARRAY_END_TAG).toString();
        }
    }

    private static int checkByte(int value, String name) {
        if (value < 0 || value > 0xFF) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    name + " must be in range 0-255 (was " + value + ")");
        }
        return value;
    }
}
