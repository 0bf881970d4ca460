package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.NetworkInterface;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <p>Listens to the SAP multicast group for announcements of AES67 streams.</p>
 *
 * <p>Each call to {@link #discover(InetAddress)} joins the group on the interface that owns the supplied
 * address, collects every datagram that arrives during the listening window, and only then parses them. The
 * window always runs to completion; there is no way to cut it short without losing announcements that were
 * already on their way.</p>
 */
@API(status = API.Status.STABLE)
public class SapListener implements StreamDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(SapListener.class);

    /**
     * The multicast group to which SAP announcements are sent (the global scope SAP address).
     */
    @API(status = API.Status.STABLE)
    public static final String SAP_MULTICAST = "239.255.255.255";

    /**
     * The port to which SAP announcements are sent.
     */
    @API(status = API.Status.STABLE)
    public static final int SAP_PORT = 9875;

    /**
     * The default number of milliseconds we listen for announcements.
     */
    @API(status = API.Status.STABLE)
    public static final long DEFAULT_LISTEN_WINDOW = 10000;

    /**
     * The longest we block in a single receive call, so that the window end is noticed promptly.
     */
    private static final int RECEIVE_SLICE = 1000;

    /**
     * The largest datagram we expect to receive.
     */
    private static final int BUFFER_SIZE = 4096;

    /**
     * How long we listen for announcements.
     */
    private final AtomicLong listenWindow = new AtomicLong(DEFAULT_LISTEN_WINDOW);

    /**
     * Set how long each discovery listens for announcements.
     *
     * @param milliseconds the length of the listening window
     */
    @API(status = API.Status.STABLE)
    public void setListenWindow(long milliseconds) {
        if (milliseconds < 1) {
            throw new IllegalArgumentException("Listen window must be positive");
        }
        listenWindow.set(milliseconds);
    }

    /**
     * Check how long each discovery listens for announcements.
     *
     * @return the length of the listening window in milliseconds
     */
    @API(status = API.Status.STABLE)
    public long getListenWindow() {
        return listenWindow.get();
    }

    @Override
    public Map<String, StreamInfo> discover(InetAddress bindAddress) throws IOException {
        final List<byte[]> received = new ArrayList<>();
        int quietSlices = 0;
        final InetSocketAddress group = new InetSocketAddress(InetAddress.getByName(SAP_MULTICAST), 0);
        final NetworkInterface networkInterface = NetworkInterface.getByInetAddress(bindAddress);
        if (networkInterface == null) {
            logger.warn("No network interface owns address {}, joining SAP group on the default interface",
                    bindAddress);
        }

        try (MulticastSocket socket = new MulticastSocket(null)) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(SAP_PORT));
            socket.joinGroup(group, networkInterface);

            final byte[] buffer = new byte[BUFFER_SIZE];
            final DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
            final long deadline = System.nanoTime() + listenWindow.get() * 1_000_000L;
            long remaining;
            while ((remaining = (deadline - System.nanoTime()) / 1_000_000L) > 0) {
                socket.setSoTimeout((int) Math.max(1, Math.min(remaining, RECEIVE_SLICE)));
                try {
                    packet.setLength(buffer.length);
                    socket.receive(packet);
                    received.add(Arrays.copyOf(packet.getData(), packet.getLength()));
                } catch (SocketTimeoutException e) {
                    quietSlices++;  // Nothing arrived, keep waiting until the window closes.
                }
            }
        }

        final Map<String, StreamInfo> result = new LinkedHashMap<>();
        for (byte[] data : received) {
            final StreamInfo stream = SapPacket.parse(data, data.length);
            if (stream != null) {
                result.put(stream.getSessionName(), stream);
            }
        }
        logger.debug("Received {} SAP packets describing {} streams ({} quiet receive slices)", received.size(),
                result.size(), quietSlices);
        return result;
    }

    @Override
    public String toString() {
        return "SapListener[group:" + SAP_MULTICAST + ":" + SAP_PORT + ", listenWindow:" + listenWindow.get() + "]";
    }
}
