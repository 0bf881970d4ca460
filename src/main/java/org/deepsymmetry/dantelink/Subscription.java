package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

/**
 * A routing entry reported by a Dante device: which source one of its receive channels is subscribed to.
 * These come straight from the device's control channel; we never create or change them ourselves.
 */
@API(status = API.Status.STABLE)
public class Subscription {

    /**
     * The name of the receiving channel on the reporting device.
     */
    @API(status = API.Status.STABLE)
    public final String rxChannelName;

    /**
     * The name of the transmitting channel. For AES67 sources this is often just the 1-based channel index
     * within the stream.
     */
    @API(status = API.Status.STABLE)
    public final String txChannelName;

    /**
     * Identifies the transmitter: a Dante device name, or for AES67 sources the origin or multicast address of
     * the stream.
     */
    @API(status = API.Status.STABLE)
    public final String txDeviceName;

    /**
     * The subscription status code reported by the device, if any.
     */
    @API(status = API.Status.STABLE)
    public final Integer statusCode;

    /**
     * Constructor simply sets the immutable fields.
     *
     * @param rxChannelName the name of the receiving channel
     * @param txChannelName the name of the transmitting channel
     * @param txDeviceName the transmitting device name or stream address
     * @param statusCode the reported status, may be {@code null}
     */
    @API(status = API.Status.STABLE)
    public Subscription(String rxChannelName, String txChannelName, String txDeviceName, Integer statusCode) {
        this.rxChannelName = rxChannelName;
        this.txChannelName = txChannelName;
        this.txDeviceName = txDeviceName;
        this.statusCode = statusCode;
    }

    @Override
    public String toString() {
        return "Subscription[rx:" + rxChannelName + ", tx:" + txDeviceName + " - " + txChannelName +
                ", status:" + statusCode + "]";
    }
}
