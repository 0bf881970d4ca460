package org.deepsymmetry.dantelink.control;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.Channel;

import java.io.IOException;

/**
 * <p>The handle through which we talk to a single Dante device over its control channel. The actual protocol
 * is implemented elsewhere; this interface is the boundary dante-link depends on.</p>
 *
 * <p>Every operation may fail with an {@link IOException} when the device cannot be reached or rejects the
 * request. Callers in this library catch and log those failures so that one misbehaving device never aborts a
 * larger operation.</p>
 *
 * <p>Not every device can be switched into AES67 mode. Rather than probing for the capability, implementations
 * report it through {@link #supportsAes67()}.</p>
 */
@API(status = API.Status.STABLE)
public interface DeviceControl {

    /**
     * Ask the device for its name, model, channels and current subscriptions.
     *
     * @return what the device reported
     *
     * @throws IOException if the device could not be queried
     */
    @API(status = API.Status.STABLE)
    DeviceControls getControls() throws IOException;

    /**
     * Ask the device to identify itself, typically by flashing an LED.
     *
     * @throws IOException if the request fails
     */
    @API(status = API.Status.STABLE)
    void identify() throws IOException;

    /**
     * Set the receive latency of the device.
     *
     * @param milliseconds the desired latency
     *
     * @throws IOException if the request fails
     */
    @API(status = API.Status.STABLE)
    void setLatency(double milliseconds) throws IOException;

    /**
     * Set the sample rate of the device.
     *
     * @param hertz the desired sample rate, one of {@link DeviceSettings#SAMPLE_RATES}
     *
     * @throws IOException if the request fails
     */
    @API(status = API.Status.STABLE)
    void setSampleRate(int hertz) throws IOException;

    /**
     * Set the PCM encoding of the device.
     *
     * @param bits the bit depth, one of {@link DeviceSettings#ENCODINGS}
     *
     * @throws IOException if the request fails
     */
    @API(status = API.Status.STABLE)
    void setEncoding(int bits) throws IOException;

    /**
     * Set the analog gain level of one channel on an AVIO adapter.
     *
     * @param channel the channel number
     * @param level the gain level, from 1 to 5; see {@link DeviceSettings#gainLabels(GainDirection)}
     * @param direction whether this is an input or output adapter
     *
     * @throws IOException if the request fails
     */
    @API(status = API.Status.STABLE)
    void setGainLevel(int channel, int level, GainDirection direction) throws IOException;

    /**
     * Subscribe a receive channel of this device to a transmit channel of another Dante device.
     *
     * @param rxChannel the receiving channel on this device
     * @param txChannel the transmitting channel
     * @param txDeviceName the name of the transmitting device
     *
     * @throws IOException if the request fails
     */
    @API(status = API.Status.STABLE)
    void addSubscription(Channel rxChannel, Channel txChannel, String txDeviceName) throws IOException;

    /**
     * Remove whatever subscription a receive channel of this device has.
     *
     * @param rxChannel the receiving channel
     *
     * @throws IOException if the request fails
     */
    @API(status = API.Status.STABLE)
    void removeSubscription(Channel rxChannel) throws IOException;

    /**
     * Check whether this device can be switched in and out of AES67 mode.
     *
     * @return {@code true} if {@link #setAes67(boolean)} is supported
     */
    @API(status = API.Status.STABLE)
    default boolean supportsAes67() {
        return false;
    }

    /**
     * Turn AES67 mode on or off.
     *
     * @param enabled whether AES67 should be enabled
     *
     * @throws IOException if the request fails
     * @throws UnsupportedOperationException if {@link #supportsAes67()} returns {@code false}
     */
    @API(status = API.Status.STABLE)
    default void setAes67(boolean enabled) throws IOException {
        throw new UnsupportedOperationException("Device does not support AES67 mode");
    }
}
