package org.deepsymmetry.dantelink.aes67;

import org.deepsymmetry.dantelink.Util;
import org.junit.Test;

import static org.junit.Assert.*;

public class SubscribeCommandTest {

    private static final StreamInfo STUDIO_A = SapPacket.parseSdp(SapPacketTest.STUDIO_A_SDP);

    @Test
    public void encodesStudioASubscription() {
        final byte[] frame = SubscribeCommand.encode(3, 1, STUDIO_A, 42);
        assertEquals(112, frame.length);
        assertEquals(0x28, Util.unsign(frame[0]));
        assertEquals(0x09, Util.unsign(frame[1]));
        assertEquals(112, Util.bytesToNumber(frame, 2, 2));
        assertEquals(42, Util.bytesToNumber(frame, 4, 2));
        assertEquals(0x3201, Util.bytesToNumber(frame, 6, 2));
        assertEquals(3, Util.bytesToNumber(frame, 96, 2));
        assertArrayEquals(new byte[] {(byte) 239, 69, 85, (byte) 220}, java.util.Arrays.copyOfRange(frame, 108, 112));
    }

    @Test
    public void encodesFixedFields() {
        final byte[] frame = SubscribeCommand.encode(3, 1, STUDIO_A, 42);
        assertArrayEquals(new byte[] {1, 1, 0, 0x10}, java.util.Arrays.copyOfRange(frame, 10, 14));
        assertEquals(0x4202, Util.bytesToNumber(frame, 18, 2));
        assertEquals(0x0001, Util.bytesToNumber(frame, 28, 2));
        assertEquals(0x0068, Util.bytesToNumber(frame, 34, 2));
        assertEquals(0x0003, Util.bytesToNumber(frame, 44, 2));
        assertEquals(0x0040, Util.bytesToNumber(frame, 46, 2));
        assertEquals(0x0002, Util.bytesToNumber(frame, 52, 2));
        assertEquals(0x0060, Util.bytesToNumber(frame, 54, 2));
        assertEquals(0x1000, Util.bytesToNumber(frame, 64, 2));
        assertEquals(0x000b, Util.bytesToNumber(frame, 66, 2));
    }

    @Test
    public void encodesStreamDetails() {
        final byte[] frame = SubscribeCommand.encode(3, 2, STUDIO_A, 0xffff);
        assertEquals(0xffff, Util.bytesToNumber(frame, 4, 2));
        assertArrayEquals(new byte[] {(byte) 192, (byte) 168, 1, 20}, java.util.Arrays.copyOfRange(frame, 68, 72));
        assertEquals(1311738121L, Util.bytesToNumber(frame, 76, 4));
        assertEquals(2, Util.bytesToNumber(frame, 98, 2));
        assertEquals(2, Util.unsign(frame[102]));
        assertEquals(0x08, Util.unsign(frame[104]));
        assertEquals(2, Util.unsign(frame[105]));
        assertEquals(5004, Util.bytesToNumber(frame, 106, 2));
    }

    @Test
    public void truncatesLargeSessionIds() {
        final StreamInfo big = new StreamInfo("Big", 0x1_2345_6789L, "10.0.0.1", "239.1.2.3", 5004, "L16/48000/8",
                8, null);
        final byte[] frame = SubscribeCommand.encode(1, 8, big, 0);
        assertEquals(0x2345_6789L, Util.bytesToNumber(frame, 76, 4));
        assertEquals(0x06, Util.unsign(frame[104]));
        assertEquals(8, Util.unsign(frame[105]));
    }

    @Test
    public void mapsEncodingBytes() {
        assertEquals(0x08, SubscribeCommand.encodingByte("L24/48000/2"));
        assertEquals(0x06, SubscribeCommand.encodingByte("L16/44100/1"));
        assertEquals(0x0a, SubscribeCommand.encodingByte("L32/96000/2"));
        assertEquals(0x08, SubscribeCommand.encodingByte("AM824/48000/2"));
        assertEquals(0x08, SubscribeCommand.encodingByte(null));
        assertEquals(0x08, SubscribeCommand.encodingByte(""));
    }

    @Test(expected = IllegalArgumentException.class)
    public void requiresMulticastAddress() {
        final StreamInfo noGroup = new StreamInfo("Unicast", 1L, "10.0.0.1", null, 5004, "L24/48000/2", 2, null);
        SubscribeCommand.encode(1, 1, noGroup, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void requiresSessionId() {
        final StreamInfo noId = new StreamInfo("NoId", null, "10.0.0.1", "239.1.1.1", 5004, "L24/48000/2", 2, null);
        SubscribeCommand.encode(1, 1, noId, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsChannelZero() {
        SubscribeCommand.encode(0, 1, STUDIO_A, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsFlowChannelZero() {
        SubscribeCommand.encode(3, 0, STUDIO_A, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsFlowChannelBeyondOneByte() {
        SubscribeCommand.encode(3, 256, STUDIO_A, 0);
    }

    @Test
    public void rejectsPortsThatDoNotFitTheFrame() {
        for (int port : new int[] {0, -1, 70000}) {
            final StreamInfo badPort = new StreamInfo("Bad Port", 1L, "10.0.0.1", "239.1.1.1", port,
                    "L24/48000/2", 2, null);
            try {
                SubscribeCommand.encode(1, 1, badPort, 0);
                fail("Port " + port + " should have been rejected");
            } catch (IllegalArgumentException e) {
                assertTrue(e.getMessage().contains(Integer.toString(port)));
            }
        }
    }

    @Test
    public void encodesLargestChannelCount() {
        final StreamInfo wide = new StreamInfo("Wide", 7L, "10.0.0.1", "239.1.1.1", 65535, "L24/48000/255",
                StreamInfo.MAXIMUM_CHANNEL_COUNT, null);
        final byte[] frame = SubscribeCommand.encode(1, 255, wide, 0);
        assertEquals(255, Util.unsign(frame[102]));
        assertEquals(255, Util.unsign(frame[105]));
        assertEquals(65535, Util.bytesToNumber(frame, 106, 2));
    }

    @Test
    public void decodesSuccess() {
        final byte[] response = {0x28, 0x01, 0, 10, 0, 42, 0x32, 0x01, 0x00, 0x01};
        final SubscribeResult result = SubscribeCommand.decodeResponse(response, response.length);
        assertTrue(result.isSuccess());
        assertEquals(SubscribeResult.Kind.SUCCESS, result.kind);
    }

    @Test
    public void decodesRejection() {
        final byte[] response = {0x28, 0x01, 0, 12, 0, 42, 0x32, 0x01, 0x00, 0x22, 0, 0};
        final SubscribeResult result = SubscribeCommand.decodeResponse(response, response.length);
        assertFalse(result.isSuccess());
        assertEquals(SubscribeResult.Kind.REJECTED, result.kind);
        assertEquals(Integer.valueOf(0x22), result.status);
    }

    @Test
    public void decodesMalformedResponses() {
        final byte[] wrongMagic = {0x28, 0x09, 0, 10, 0, 42, 0x32, 0x01, 0x00, 0x01};
        assertEquals(SubscribeResult.Kind.MALFORMED_RESPONSE,
                SubscribeCommand.decodeResponse(wrongMagic, wrongMagic.length).kind);
        final byte[] tooShort = {0x28, 0x01, 0, 9, 0, 42, 0x32, 0x01, 0x00};
        final SubscribeResult shortResult = SubscribeCommand.decodeResponse(tooShort, tooShort.length);
        assertEquals(SubscribeResult.Kind.MALFORMED_RESPONSE, shortResult.kind);
        assertNull(shortResult.status);
    }
}
