package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;

import java.net.InetAddress;

/**
 * Sends a subscribe command frame to a device and waits for its acknowledgement. Implementations block, so callers
 * which must stay responsive run them on a separate thread.
 */
@API(status = API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface CommandSender {

    /**
     * Send a command frame and report what the device made of it. Failures are reported through the result rather
     * than thrown, so that a timeout can be told apart from a refusal.
     *
     * @param device the address of the Dante device
     * @param frame the encoded command, as built by {@link SubscribeCommand#encode(int, int, StreamInfo, int)}
     *
     * @return the outcome of the exchange
     */
    @API(status = API.Status.EXPERIMENTAL)
    SubscribeResult send(InetAddress device, byte[] frame);
}
