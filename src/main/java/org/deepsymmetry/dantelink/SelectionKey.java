package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

import java.util.Objects;

/**
 * Identifies a single receive channel of a single device, as the target of a source selection.
 */
@API(status = API.Status.STABLE)
public class SelectionKey {

    /**
     * The display name of the device.
     */
    @API(status = API.Status.STABLE)
    public final String deviceName;

    /**
     * The receive channel number.
     */
    @API(status = API.Status.STABLE)
    public final int rxChannel;

    /**
     * Constructor sets all the immutable interpreted fields.
     *
     * @param deviceName the display name of the device
     * @param rxChannel the receive channel number
     */
    @API(status = API.Status.STABLE)
    public SelectionKey(String deviceName, int rxChannel) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.rxChannel = rxChannel;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SelectionKey)) {
            return false;
        }
        final SelectionKey other = (SelectionKey) obj;
        return rxChannel == other.rxChannel && deviceName.equals(other.deviceName);
    }

    @Override
    public int hashCode() {
        return 31 * deviceName.hashCode() + rxChannel;
    }

    @Override
    public String toString() {
        return "SelectionKey[device:" + deviceName + ", rx:" + rxChannel + "]";
    }
}
