package com.questrail.osc.transport;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OscUrlTest
{
    @Test
    void rendersEachProtocol()
    {
        assertEquals("osc.udp://localhost:9000/", OscUrl.of(OscProtocol.UDP, "localhost", 9000).toString());
        assertEquals("osc.tcp://10.0.0.1:57120/", OscUrl.of(OscProtocol.TCP, "10.0.0.1", 57120).toString());
        assertEquals("osc.unix:///tmp/osc.sock/", OscUrl.unix("/tmp/osc.sock").toString());
        assertEquals("osc.udp://[::1]:9000/", OscUrl.of(OscProtocol.UDP, "::1", 9000).toString());
    }

    @Test
    void parsesWhatItRenders()
    {
        for (String text : new String[] {
                "osc.udp://localhost:9000/", "osc.tcp://example.org:1/", "osc.unix:///var/run/osc/",
                "osc.udp://[fe80::1]:8000/"}) {
            assertEquals(text, OscUrl.parse(text).toString());
        }
    }

    @Test
    void parseExtractsComponents()
    {
        OscUrl url = OscUrl.parse("osc.tcp://synth.local:57120");
        assertEquals(OscProtocol.TCP, url.protocol());
        assertEquals("synth.local", url.host());
        assertEquals(57120, url.port());

        OscUrl unix = OscUrl.parse("osc.unix:///tmp/s/");
        assertEquals(OscProtocol.UNIX, unix.protocol());
        assertEquals("/tmp/s", unix.path());

        assertEquals("::1", OscUrl.parse("osc.udp://[::1]:1234/").host());
    }

    @Test
    void malformedUrlsAreAddressErrors()
    {
        for (String bad : new String[] {
                "udp://host:1/", "osc.udp:host:1", "osc.udp://host/", "osc.udp://:9000/",
                "osc.udp://host:abc/", "osc.udp://host:70000/", "osc.unix:///", "osc.udp://[::1/"}) {
            OscException e = assertThrows(OscException.class, () -> OscUrl.parse(bad), bad);
            assertEquals(OscErrorCode.ADDRESS_ERROR, e.code(), bad);
        }
    }

    @Test
    void schemeLookupKnowsStreamProtocols()
    {
        assertEquals(OscProtocol.UNIX, OscProtocol.fromScheme("osc.unix"));
        assertTrue(OscProtocol.TCP.isStream());
        assertTrue(OscProtocol.UNIX.isStream());
        assertFalse(OscProtocol.UDP.isStream());
    }
}
