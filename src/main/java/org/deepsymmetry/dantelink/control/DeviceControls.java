package org.deepsymmetry.dantelink.control;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.Channel;
import org.deepsymmetry.dantelink.Subscription;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Holds what a device told us about itself in response to {@link DeviceControl#getControls()}. Any field the
 * device did not report is {@code null} (or empty, for the collections).
 */
@API(status = API.Status.STABLE)
public class DeviceControls {

    /**
     * The name configured on the device.
     */
    @API(status = API.Status.STABLE)
    public final String name;

    /**
     * The manufacturer reported by the device.
     */
    @API(status = API.Status.STABLE)
    public final String manufacturer;

    /**
     * The model name reported by the device.
     */
    @API(status = API.Status.STABLE)
    public final String model;

    /**
     * The software description, if the device reports one.
     */
    @API(status = API.Status.STABLE)
    public final String software;

    /**
     * The receive channels, by channel number.
     */
    @API(status = API.Status.STABLE)
    public final SortedMap<Integer, Channel> rxChannels;

    /**
     * The transmit channels, by channel number.
     */
    @API(status = API.Status.STABLE)
    public final SortedMap<Integer, Channel> txChannels;

    /**
     * The subscriptions of the receive channels, in the order the device reported them.
     */
    @API(status = API.Status.STABLE)
    public final List<Subscription> subscriptions;

    /**
     * Constructor simply captures the reported values, copying the collections.
     *
     * @param name the device name
     * @param manufacturer the manufacturer
     * @param model the model name
     * @param software the software description
     * @param rxChannels the receive channels by number
     * @param txChannels the transmit channels by number
     * @param subscriptions the reported subscriptions
     */
    @API(status = API.Status.STABLE)
    public DeviceControls(String name, String manufacturer, String model, String software,
                          Map<Integer, Channel> rxChannels, Map<Integer, Channel> txChannels,
                          List<Subscription> subscriptions) {
        this.name = name;
        this.manufacturer = manufacturer;
        this.model = model;
        this.software = software;
        this.rxChannels = Collections.unmodifiableSortedMap(new TreeMap<>(rxChannels == null? Map.of() : rxChannels));
        this.txChannels = Collections.unmodifiableSortedMap(new TreeMap<>(txChannels == null? Map.of() : txChannels));
        this.subscriptions = (subscriptions == null)? List.of() : List.copyOf(subscriptions);
    }

    @Override
    public String toString() {
        return "DeviceControls[name:" + name + ", model:" + model + ", rx:" + rxChannels.size() +
                ", tx:" + txChannels.size() + ", subscriptions:" + subscriptions.size() + "]";
    }
}
