package org.deepsymmetry.dantelink.aes67;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

public class SapPacketTest {

    static final String STUDIO_A_SDP = "v=0\r\n" +
            "o=- 1311738121 1311738121 IN IP4 192.168.1.20\r\n" +
            "s=Studio A\r\n" +
            "i=2 channels: Tx Left, Tx Right\r\n" +
            "c=IN IP4 239.69.85.220/32\r\n" +
            "t=0 0\r\n" +
            "m=audio 5004 RTP/AVP 97\r\n" +
            "a=rtpmap:97 L24/48000/2\r\n";

    /**
     * Build a SAP packet with an IPv4 origin and no authentication data.
     */
    static byte[] sapPacket(int firstByte, String mimeType, String sdp) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(firstByte);
        out.write(0);        // No authentication.
        out.write(0x12);     // Message id hash.
        out.write(0x34);
        out.writeBytes(new byte[] {(byte) 192, (byte) 168, 1, 20});
        if (mimeType != null) {
            out.writeBytes(mimeType.getBytes(StandardCharsets.US_ASCII));
            out.write(0);
        }
        out.writeBytes(sdp.getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    /**
     * Build a SAP packet whose origin and authentication data have the lengths given, so the parser must skip them.
     */
    static byte[] sapPacket(int firstByte, int originLength, int authWords, String sdp) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(firstByte);
        out.write(authWords);
        out.write(0x12);
        out.write(0x34);
        for (int i = 0; i < originLength; i++) {
            out.write(0xfe - i);
        }
        for (int i = 0; i < authWords * 4; i++) {
            out.write(i);  // Includes a null byte, which must not be mistaken for a payload type terminator.
        }
        out.writeBytes(sdp.getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    @Test
    public void parsesAnnouncement() {
        final byte[] packet = sapPacket(0x20, null, STUDIO_A_SDP);
        final StreamInfo stream = SapPacket.parse(packet, packet.length);
        assertNotNull(stream);
        assertEquals("Studio A", stream.getSessionName());
        assertEquals(Long.valueOf(1311738121L), stream.getSessionId());
        assertEquals("192.168.1.20", stream.getOriginIp());
        assertEquals("239.69.85.220", stream.getMulticastAddr());
        assertEquals(Integer.valueOf(5004), stream.getPort());
        assertEquals("L24/48000/2", stream.getCodec());
        assertEquals(2, stream.getChannelCount());
        assertEquals("2 channels: Tx Left, Tx Right", stream.getChannelInfo());
        assertEquals(List.of("Tx Left", "Tx Right"), stream.getChannelNames());
    }

    @Test
    public void skipsPayloadType() {
        final byte[] packet = sapPacket(0x20, "application/sdp", STUDIO_A_SDP);
        final StreamInfo stream = SapPacket.parse(packet, packet.length);
        assertNotNull(stream);
        assertEquals("Studio A", stream.getSessionName());
        assertEquals(2, stream.getChannelCount());
    }

    @Test
    public void ignoresTrailingBufferSpace() {
        final byte[] packet = sapPacket(0x20, null, STUDIO_A_SDP);
        final byte[] buffer = new byte[4096];
        System.arraycopy(packet, 0, buffer, 0, packet.length);
        final StreamInfo stream = SapPacket.parse(buffer, packet.length);
        assertNotNull(stream);
        assertEquals("Studio A", stream.getSessionName());
        assertEquals("L24/48000/2", stream.getCodec());
    }

    @Test
    public void rejectsDeletion() {
        final byte[] packet = sapPacket(0x24, null, STUDIO_A_SDP);
        assertNull(SapPacket.parse(packet, packet.length));
    }

    @Test
    public void rejectsOtherVersions() {
        final byte[] version2 = sapPacket(0x40, null, STUDIO_A_SDP);
        assertNull(SapPacket.parse(version2, version2.length));
        final byte[] version0 = sapPacket(0x00, null, STUDIO_A_SDP);
        assertNull(SapPacket.parse(version0, version0.length));
    }

    @Test
    public void rejectsShortPackets() {
        assertNull(SapPacket.parse(new byte[] {0x20, 0, 0, 0, 1, 2, 3}, 7));
        final byte[] headerOnly = {0x20, 0, 0x12, 0x34, (byte) 192, (byte) 168, 1, 20};
        assertNull(SapPacket.parse(headerOnly, headerOnly.length));
    }

    @Test
    public void rejectsUnterminatedPayloadType() {
        final byte[] packet = sapPacket(0x20, null, "application/sdp with no terminator");
        assertNull(SapPacket.parse(packet, packet.length));
    }

    @Test
    public void rejectsMissingSessionName() {
        final byte[] packet = sapPacket(0x20, null, STUDIO_A_SDP.replace("s=Studio A\r\n", ""));
        assertNull(SapPacket.parse(packet, packet.length));
    }

    @Test
    public void toleratesMalformedLines() {
        final StreamInfo stream = SapPacket.parseSdp("v=0\n" +
                "o=- notanumber 1 IN IP4 10.0.0.5\n" +
                "s=Odd Stream\n" +
                "c=IN\n" +
                "m=audio port RTP/AVP 96\n" +
                "a=rtpmap:96 L16/48000\n");
        assertNotNull(stream);
        assertEquals("Odd Stream", stream.getSessionName());
        assertNull(stream.getSessionId());
        assertEquals("10.0.0.5", stream.getOriginIp());
        assertNull(stream.getMulticastAddr());
        assertNull(stream.getPort());
        assertEquals("L16/48000", stream.getCodec());
        assertEquals(1, stream.getChannelCount());
        assertEquals(List.of("Mono"), stream.getChannelNames());
    }

    @Test
    public void acceptsUnixLineEndings() {
        final StreamInfo stream = SapPacket.parseSdp(STUDIO_A_SDP.replace("\r\n", "\n"));
        assertNotNull(stream);
        assertEquals("239.69.85.220", stream.getMulticastAddr());
        assertEquals(Integer.valueOf(5004), stream.getPort());
    }

    @Test
    public void skipsIpv6Origin() {
        final byte[] packet = sapPacket(0x30, 16, 0, STUDIO_A_SDP);
        final StreamInfo stream = SapPacket.parse(packet, packet.length);
        assertNotNull(stream);
        assertEquals("Studio A", stream.getSessionName());
        assertEquals("192.168.1.20", stream.getOriginIp());
        assertEquals(2, stream.getChannelCount());
    }

    @Test
    public void skipsAuthenticationData() {
        final byte[] ipv4 = sapPacket(0x20, 4, 2, STUDIO_A_SDP);
        final StreamInfo stream = SapPacket.parse(ipv4, ipv4.length);
        assertNotNull(stream);
        assertEquals("Studio A", stream.getSessionName());
        assertEquals("L24/48000/2", stream.getCodec());

        final byte[] ipv6 = sapPacket(0x30, 16, 3, STUDIO_A_SDP);
        final StreamInfo fromIpv6 = SapPacket.parse(ipv6, ipv6.length);
        assertNotNull(fromIpv6);
        assertEquals("239.69.85.220", fromIpv6.getMulticastAddr());
    }

    @Test
    public void rejectsAuthenticationLengthPastPacketEnd() {
        final byte[] packet = sapPacket(0x20, null, STUDIO_A_SDP);
        packet[1] = (byte) 0xff;  // 1020 bytes of authentication data, longer than the whole packet.
        assertNull(SapPacket.parse(packet, packet.length));

        // Authentication data that ends exactly at the end of the packet leaves no payload.
        final byte[] exact = sapPacket(0x20, 4, 2, "");
        assertEquals(16, exact.length);
        assertNull(SapPacket.parse(exact, exact.length));
    }

    @Test
    public void rejectsIpv6OriginPastPacketEnd() {
        final byte[] packet = sapPacket(0x30, 4, 0, "v=0\r\n");
        assertNull(SapPacket.parse(packet, packet.length));
    }

    @Test
    public void ignoresOversizedChannelCount() {
        for (String count : new String[] {"256", "2147483647"}) {
            final StreamInfo stream = SapPacket.parseSdp(STUDIO_A_SDP.replace("L24/48000/2", "L24/48000/" + count));
            assertNotNull(stream);
            assertEquals("L24/48000/" + count, stream.getCodec());
            assertEquals(1, stream.getChannelCount());
            assertEquals(List.of("Mono"), stream.getChannelNames());
        }
    }

    @Test
    public void acceptsLargestChannelCount() {
        final StreamInfo stream = SapPacket.parseSdp(STUDIO_A_SDP.replace("L24/48000/2", "L24/48000/255"));
        assertNotNull(stream);
        assertEquals(StreamInfo.MAXIMUM_CHANNEL_COUNT, stream.getChannelCount());
        assertEquals("Ch255", stream.getChannelNames().get(254));
    }
}
