package com.questrail.osc.codec.impl;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.model.OscBundle;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscPacket;
import com.questrail.osc.model.OscTimeTag;
import com.questrail.osc.model.OscValue;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OscBundleCodecTest
 * -----------------------------------------------------------------------------
 * Bundle header, element framing, nesting and element validation.
 */
final class OscBundleCodecTest
{
    private static final OscTimeTag TIME = new OscTimeTag(0x83AA7E80L, 0x40000000L);

    @Test
    void headerIsMagicFollowedByBigEndianTimeTag()
    {
        byte[] bytes = OscBundle.builder(TIME).build().serialize();

        assertEquals(16, bytes.length);
        assertArrayEquals("#bundle\0".getBytes(java.nio.charset.StandardCharsets.US_ASCII),
                Arrays.copyOf(bytes, 8));
        assertArrayEquals(new byte[] {(byte) 0x83, (byte) 0xAA, 0x7E, (byte) 0x80, 0x40, 0, 0, 0},
                Arrays.copyOfRange(bytes, 8, 16));
    }

    @Test
    void elementsArePrefixedWithTheirSize()
    {
        OscMessage m = OscMessage.of("/foo", OscValue.int32(1));
        byte[] bytes = OscBundle.of(OscTimeTag.immediate(), m).serialize();

        ByteBuffer buf = ByteBuffer.wrap(bytes, 16, bytes.length - 16);
        assertEquals(16, buf.getInt());
        byte[] element = new byte[16];
        buf.get(element);
        assertArrayEquals(m.serialize(), element);
        assertFalse(buf.hasRemaining());
    }

    @Test
    void nestedBundleRoundTrips()
    {
        OscMessage outer = OscMessage.builder("/outer").addFloat(1.5f).build();
        OscMessage inner = OscMessage.builder("/inner").addString("deep").build();
        OscBundle bundle = OscBundle.builder(TIME)
                .addMessage(outer)
                .addBundle(OscBundle.of(OscTimeTag.immediate(), inner))
                .build();

        OscPacket decoded = OscPacket.deserialize(bundle.serialize());

        OscBundle b = assertInstanceOf(OscBundle.class, decoded);
        assertEquals(TIME, b.timeTag());
        assertEquals(bundle, b);
        assertEquals(List.of(outer), b.messages());
        assertEquals(1, b.bundles().size());
        assertTrue(b.bundles().get(0).timeTag().isImmediate());
        assertEquals(List.of(inner), b.bundles().get(0).messages());
    }

    @Test
    void interleavedElementOrderIsPreserved()
    {
        OscMessage a = OscMessage.of("/a");
        OscMessage c = OscMessage.of("/c");
        OscBundle b = OscBundle.of(OscTimeTag.immediate(), OscMessage.of("/b"));
        OscBundle bundle = OscBundle.builder().addMessage(a).addBundle(b).addMessage(c).build();

        OscBundle decoded = OscBundle.deserialize(bundle.serialize());

        assertEquals(List.of(a, b, c), decoded.elements());
    }

    @Test
    void forEachVisitsMessagesDepthFirst()
    {
        OscBundle bundle = OscBundle.builder()
                .addMessage(OscMessage.of("/1"))
                .addBundle(OscBundle.builder()
                        .addMessage(OscMessage.of("/2"))
                        .addBundle(OscBundle.of(OscTimeTag.immediate(), OscMessage.of("/3")))
                        .build())
                .addMessage(OscMessage.of("/4"))
                .build();

        List<String> seen = new ArrayList<>();
        OscBundle.deserialize(bundle.serialize()).forEach(m -> seen.add(m.path()));

        assertEquals(List.of("/1", "/2", "/3", "/4"), seen);
    }

    @Test
    void emptyBundleRoundTrips()
    {
        OscBundle empty = OscBundle.builder(TIME).build();
        OscBundle decoded = OscBundle.deserialize(empty.serialize());
        assertTrue(decoded.isEmpty());
        assertEquals(TIME, decoded.timeTag());
    }

    @Test
    void rejectsZeroSizeElement()
    {
        byte[] bytes = withElementSize(0, new byte[8]);
        assertMalformed(bytes);
    }

    @Test
    void rejectsElementLongerThanRemainingInput()
    {
        byte[] bytes = withElementSize(64, OscMessage.of("/foo").serialize());
        assertMalformed(bytes);
    }

    @Test
    void rejectsElementTooSmallToBeAPacket()
    {
        byte[] bytes = withElementSize(4, new byte[] {'/', 'a', 0, 0});
        assertMalformed(bytes);
    }

    @Test
    void rejectsBadMagicAndShortHeader()
    {
        byte[] bytes = OscBundle.builder().build().serialize();
        bytes[1] = 'B';
        assertMalformed(bytes);

        assertEquals(OscErrorCode.MALFORMED_PACKET, assertThrows(OscException.class,
                () -> OscBundleCodec.decode(bytes, 0, 12)).code());
    }

    @Test
    void elementFailureNamesTheElementIndex()
    {
        OscBundle ok = OscBundle.of(OscTimeTag.immediate(), OscMessage.of("/ok"), OscMessage.of("/bad"));
        byte[] bytes = ok.serialize();
        // second element starts after header (16), size word (4), "/ok" element (8) and its size word (4)
        bytes[16 + 4 + 8 + 4] = 'x';

        OscException e = assertThrows(OscException.class, () -> OscBundle.deserialize(bytes));
        assertEquals(OscErrorCode.ADDRESS_ERROR, e.code());
        assertTrue(e.getMessage().contains("element 1"), e.getMessage());
    }

    @Test
    void nestingBeyondMaximumDepthIsRejected()
    {
        OscBundle nested = OscBundle.builder()
                .addBundle(OscBundle.builder().addBundle(OscBundle.builder().build()).build())
                .build();
        byte[] bytes = nested.serialize();

        assertEquals(nested, new DefaultOscPacketDecoder(2).decode(bytes));
        OscException e = assertThrows(OscException.class, () -> new DefaultOscPacketDecoder(1).decode(bytes));
        assertEquals(OscErrorCode.MALFORMED_PACKET, e.code());
    }

    @Test
    void hostileElementSizeInNestedBundleIsMalformed()
    {
        for (int declared : new int[] {Integer.MAX_VALUE, Integer.MIN_VALUE, -8}) {
            byte[] inner = withElementSize(declared, new byte[] {'/', 'a', 0, 0});
            byte[] outer = withElementSize(inner.length, inner);

            OscException e = assertThrows(OscException.class, () -> OscBundle.deserialize(outer),
                    "declared size " + declared);
            assertEquals(OscErrorCode.MALFORMED_PACKET, e.code());
            assertTrue(e.getMessage().contains("in bundle element 0"));
        }
    }

    @Test
    void packetDecoderDistinguishesBundlesFromMessages()
    {
        DefaultOscPacketDecoder decoder = new DefaultOscPacketDecoder();
        DefaultOscPacketEncoder encoder = new DefaultOscPacketEncoder();

        OscMessage m = OscMessage.of("/bundle", OscValue.string("not one"));
        OscBundle b = OscBundle.of(TIME, m);

        assertEquals(m, decoder.decode(encoder.encode(m)));
        assertEquals(b, decoder.decode(encoder.encode(b)));
        assertTrue(b.isBundle());
        assertFalse(m.isBundle());
    }

    private static byte[] withElementSize(int declared, byte[] element)
    {
        return ByteBuffer.allocate(16 + 4 + element.length)
                .put(OscBundle.builder().build().serialize())
                .putInt(declared)
                .put(element)
                .array();
    }

    private static void assertMalformed(byte[] bytes)
    {
        OscException e = assertThrows(OscException.class, () -> OscBundle.deserialize(bytes));
        assertEquals(OscErrorCode.MALFORMED_PACKET, e.code());
    }
}
