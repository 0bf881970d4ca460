package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Map;

/**
 * Listens for AES67 stream announcements for a bounded window of time.
 */
@API(status = API.Status.STABLE)
@FunctionalInterface
public interface StreamDiscovery {

    /**
     * Listen for stream announcements, blocking until the listening window has closed.
     *
     * @param bindAddress the local address of the interface facing the network the streams are on
     *
     * @return the streams heard during the window, keyed by session name
     *
     * @throws IOException if we are unable to listen for announcements
     */
    @API(status = API.Status.STABLE)
    Map<String, StreamInfo> discover(InetAddress bindAddress) throws IOException;
}
