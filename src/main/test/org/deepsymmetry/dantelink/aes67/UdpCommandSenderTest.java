package org.deepsymmetry.dantelink.aes67;

import org.junit.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class UdpCommandSenderTest {

    /**
     * Answer a single datagram on a loopback socket with the supplied response.
     */
    private static Thread respondOnce(final DatagramSocket responder, final byte[] response,
                                      final AtomicReference<byte[]> received) {
        final Thread thread = new Thread(() -> {
            try {
                final byte[] buffer = new byte[512];
                final DatagramPacket request = new DatagramPacket(buffer, buffer.length);
                responder.receive(request);
                final byte[] copy = new byte[request.getLength()];
                System.arraycopy(buffer, 0, copy, 0, copy.length);
                received.set(copy);
                responder.send(new DatagramPacket(response, response.length, request.getSocketAddress()));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        thread.start();
        return thread;
    }

    @Test
    public void reportsAcknowledgement() throws Exception {
        try (DatagramSocket responder = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            responder.setSoTimeout(5000);
            final AtomicReference<byte[]> received = new AtomicReference<>();
            final Thread thread = respondOnce(responder, new byte[] {0x28, 0x01, 0, 10, 0, 1, 0x32, 0x01, 0, 1},
                    received);
            final UdpCommandSender sender = new UdpCommandSender(responder.getLocalPort());
            final byte[] frame = SubscribeCommand.encode(3, 1, SapPacket.parseSdp(SapPacketTest.STUDIO_A_SDP), 42);
            final SubscribeResult result = sender.send(InetAddress.getLoopbackAddress(), frame);
            thread.join(5000);
            assertTrue(result.toString(), result.isSuccess());
            assertArrayEquals(frame, received.get());
        }
    }

    @Test
    public void reportsRejectionStatus() throws Exception {
        try (DatagramSocket responder = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            responder.setSoTimeout(5000);
            final Thread thread = respondOnce(responder, new byte[] {0x28, 0x01, 0, 10, 0, 1, 0x32, 0x01, 0, 7},
                    new AtomicReference<>());
            final UdpCommandSender sender = new UdpCommandSender(responder.getLocalPort());
            final SubscribeResult result = sender.send(InetAddress.getLoopbackAddress(), new byte[112]);
            thread.join(5000);
            assertEquals(SubscribeResult.Kind.REJECTED, result.kind);
            assertEquals(Integer.valueOf(7), result.status);
        }
    }

    @Test
    public void reportsTimeoutSeparately() throws Exception {
        try (DatagramSocket silent = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            final UdpCommandSender sender = new UdpCommandSender(silent.getLocalPort());
            sender.setResponseTimeout(200);
            final SubscribeResult result = sender.send(InetAddress.getLoopbackAddress(), new byte[112]);
            assertEquals(SubscribeResult.Kind.TIMEOUT, result.kind);
            assertNull(result.status);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveTimeout() {
        new UdpCommandSender().setResponseTimeout(0);
    }
}
