package org.deepsymmetry.dantelink;

import org.junit.Test;

import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class UtilTest {

    @Test
    public void normalizesServerNames() {
        assertEquals("switch1", Util.normalizeServerName("switch1.local."));
        assertEquals("switch1", Util.normalizeServerName("switch1.local"));
        assertEquals("switch1", Util.normalizeServerName("switch1."));
        assertEquals("studio.lan", Util.normalizeServerName("studio.lan."));
        assertNull(Util.normalizeServerName(null));
    }

    @Test
    public void derivesServerNameFromInstance() {
        assertEquals("AVIO-123", Util.serverNameFromInstance("AVIO-123._netaudio-arc._udp.local."));
        assertEquals("plain", Util.serverNameFromInstance("plain"));
    }

    @Test
    public void decodesMalformedTextLossily() {
        final byte[] bytes = {'o', 'k', (byte) 0xff, '!'};
        assertEquals("ok\uFFFD!", Util.decodeLossy(bytes, 0, bytes.length));
        final byte[] text = "xxHello".getBytes(StandardCharsets.UTF_8);
        assertEquals("Hello", Util.decodeLossy(text, 2, 5));
    }

    @Test
    public void convertsNumbers() {
        final byte[] buffer = new byte[6];
        Util.numberToBytes(0x12345678L, buffer, 1, 4);
        assertArrayEquals(new byte[] {0, 0x12, 0x34, 0x56, 0x78, 0}, buffer);
        assertEquals(0x12345678L, Util.bytesToNumber(buffer, 1, 4));
        Util.numberToBytes(0x1ffff, buffer, 0, 2);
        assertEquals(0xffff, Util.bytesToNumber(buffer, 0, 2));
        assertEquals(255, Util.unsign((byte) -1));
    }

    @Test
    public void findsLoopbackRoute() {
        final InetAddress local = Util.findBindAddress(Arrays.asList(null, "", "127.0.0.1"));
        assertNotNull(local);
        assertTrue(local.isLoopbackAddress());
    }

    @Test
    public void findsNothingWithoutAddresses() {
        assertNull(Util.findBindAddress(List.of()));
    }
}
