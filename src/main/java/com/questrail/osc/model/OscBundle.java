package com.questrail.osc.model;

import com.questrail.osc.codec.impl.OscBundleCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * OscBundle
 * -----------------------------------------------------------------------------
 * A time tag plus one ordered list of packets (messages and nested bundles).
 *
 * <p>Wire order is exactly insertion order, for messages and bundles alike.
 * {@link #messages()} and {@link #bundles()} are filtered views of the same
 * list and do not define an order between the two kinds.</p>
 */
public record OscBundle(OscTimeTag timeTag, List<OscPacket> elements) implements OscPacket
{
    public OscBundle {
        Objects.requireNonNull(timeTag, "timeTag");
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
    }

    public static OscBundle of(OscTimeTag timeTag, OscPacket... elements) {
        return new OscBundle(timeTag, List.of(elements));
    }

    public static Builder builder() {
        return new Builder(OscTimeTag.immediate());
    }

    public static Builder builder(OscTimeTag timeTag) {
        return new Builder(timeTag);
    }

    /**
     * Decodes a bundle from its exact wire bytes.
     */
    public static OscBundle deserialize(byte[] data) {
        return OscBundleCodec.decode(data, 0, data.length);
    }

    /** Direct child messages, in element order. */
    public List<OscMessage> messages() {
        List<OscMessage> out = new ArrayList<>();
        for (OscPacket p : elements) {
            if (p instanceof OscMessage m) {
                out.add(m);
            }
        }
        return List.copyOf(out);
    }

    /** Direct child bundles, in element order. */
    public List<OscBundle> bundles() {
        List<OscBundle> out = new ArrayList<>();
        for (OscPacket p : elements) {
            if (p instanceof OscBundle b) {
                out.add(b);
            }
        }
        return List.copyOf(out);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Visits every message in this bundle and all descendant bundles,
     * depth-first in element order.
     */
    public void forEach(Consumer<? super OscMessage> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (OscPacket p : elements) {
            if (p instanceof OscMessage m) {
                visitor.accept(m);
            }
            else {
                ((OscBundle) p).forEach(visitor);
            }
        }
    }

    @Override
    public byte[] serialize() {
        return OscBundleCodec.encode(this);
    }

    public static final class Builder
    {
        private final OscTimeTag timeTag;
        private final List<OscPacket> elements = new ArrayList<>();

        private Builder(OscTimeTag timeTag) {
            this.timeTag = Objects.requireNonNull(timeTag, "timeTag");
        }

        public Builder addMessage(OscMessage message) {
            return addPacket(message);
        }

        public Builder addBundle(OscBundle bundle) {
            return addPacket(bundle);
        }

        public Builder addPacket(OscPacket packet) {
            elements.add(Objects.requireNonNull(packet, "packet"));
            return this;
        }

        public OscBundle build() {
            return new OscBundle(timeTag, elements);
        }
    }
}
