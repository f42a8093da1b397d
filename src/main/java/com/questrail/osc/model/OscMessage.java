package com.questrail.osc.model;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.codec.impl.OscMessageCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OscMessage
 * -----------------------------------------------------------------------------
 * An OSC address plus an ordered, immutable list of arguments.
 *
 * <p>The path must be non-empty and start with {@code '/'}; anything else is
 * rejected with {@link OscErrorCode#ADDRESS_ERROR}. Paths may not contain NUL
 * since NUL terminates the path on the wire.</p>
 *
 * <p>Messages are usually assembled with {@link #builder(String)}:</p>
 * <pre>
 *   OscMessage m = OscMessage.builder("/mixer/gain")
 *           .addInt32(3)
 *           .addFloat(0.75f)
 *           .build();
 * </pre>
 */
public record OscMessage(String path, List<OscValue> arguments) implements OscPacket
{
    public OscMessage {
        validatePath(path);
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
    }

    public static OscMessage of(String path, OscValue... arguments) {
        return new OscMessage(path, List.of(arguments));
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    /**
     * Decodes a message from its exact wire bytes.
     */
    public static OscMessage deserialize(byte[] data) {
        return OscMessageCodec.decode(data, 0, data.length);
    }

    public OscValue argument(int index) {
        if (index < 0 || index >= arguments.size()) {
            throw new OscException(OscErrorCode.INVALID_ARGUMENT,
                    "Argument index " + index + " out of range for " + arguments.size() + " arguments");
        }
        return arguments.get(index);
    }

    public int size() {
        return arguments.size();
    }

    /**
     * Type tag string of the arguments without the leading comma.
     */
    public String typeTags() {
        StringBuilder sb = new StringBuilder(arguments.size());
        for (OscValue v : arguments) {
            sb.append(v.typeTags());
        }
        return sb.toString();
    }

    @Override
    public byte[] serialize() {
        return OscMessageCodec.encode(this);
    }

    @Override
    public String toString() {
        return "OscMessage[" + path + " ," + typeTags() + " " + arguments + "]";
    }

    private static void validatePath(String path) {
        if (path == null || path.isEmpty() || path.charAt(0) != '/') {
            throw new OscException(OscErrorCode.ADDRESS_ERROR,
                    "OSC address must start with '/': " + (path == null ? "null" : "'" + path + "'"));
        }
        if (path.indexOf('\0') >= 0) {
            throw new OscException(OscErrorCode.ADDRESS_ERROR,
                    "OSC address must not contain NUL: '" + path.replace('\0', '?') + "'");
        }
    }

    /**
     * Chainable builder. Not thread-safe; {@link #build()} may be called more
     * than once and each call snapshots the arguments added so far.
     */
    public static final class Builder
    {
        private final String path;
        private final List<OscValue> arguments = new ArrayList<>();

        private Builder(String path) {
            validatePath(path);
            this.path = path;
        }

        public Builder addInt32(int value) { return addValue(OscValue.int32(value)); }

        public Builder addInt64(long value) { return addValue(OscValue.int64(value)); }

        public Builder addFloat(float value) { return addValue(OscValue.float32(value)); }

        public Builder addDouble(double value) { return addValue(OscValue.float64(value)); }

        public Builder addString(String value) { return addValue(OscValue.string(value)); }

        public Builder addSymbol(String value) { return addValue(OscValue.symbol(value)); }

        public Builder addBlob(byte[] value) { return addValue(OscValue.blob(value)); }

        public Builder addTimeTag(OscTimeTag value) { return addValue(OscValue.timeTag(value)); }

        public Builder addChar(char value) { return addValue(OscValue.character(value)); }

        public Builder addColor(int rgba) { return addValue(OscValue.color(rgba)); }

        public Builder addColor(int red, int green, int blue, int alpha) {
            return addValue(OscValue.color(red, green, blue, alpha));
        }

        public Builder addMidi(int port, int status, int data1, int data2) {
            return addValue(OscValue.midi(port, status, data1, data2));
        }

        public Builder addTrue() { return addValue(OscValue.bool(true)); }

        public Builder addFalse() { return addValue(OscValue.bool(false)); }

        public Builder addBool(boolean value) { return addValue(OscValue.bool(value)); }

        public Builder addNil() { return addValue(OscValue.nil()); }

        public Builder addInfinitum() { return addValue(OscValue.infinitum()); }

        public Builder addArray(List<OscValue> elements) { return addValue(OscValue.array(elements)); }

        public Builder addArray(OscValue... elements) { return addValue(OscValue.array(elements)); }

        public Builder addValue(OscValue value) {
            arguments.add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public OscMessage build() {
            return new OscMessage(path, arguments);
        }
    }
}
