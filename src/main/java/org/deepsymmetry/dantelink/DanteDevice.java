package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.control.DeviceControl;
import org.deepsymmetry.dantelink.control.DeviceControls;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <p>Represents one physical Dante device found on the network, combining what it advertised over mDNS with what
 * it reported over its control channel.</p>
 *
 * <p>A new instance is built for each device on every refresh pass. The identity fields are filled in by the
 * {@link DeviceConsolidator} from the union of the device's service records, and the channel and subscription
 * details by the {@link DanteNetwork} from the device's control channel. Once a pass publishes its snapshot, the
 * instances in it are no longer changed.</p>
 */
@API(status = API.Status.STABLE)
public class DanteDevice {

    /**
     * The normalized mDNS host name which identifies the device within a pass.
     */
    private final String serverName;

    private String name;
    private String ipv4;
    private String macAddress;
    private String modelId;
    private String model;
    private String manufacturer;
    private String software;
    private Integer sampleRate;
    private Long latencyNs;
    private int rxCount;
    private int txCount;

    /**
     * The service records that were merged to form this device, keyed by instance name.
     */
    private final Map<String, ServiceRecord> services = new LinkedHashMap<>();

    private SortedMap<Integer, Channel> rxChannels = Collections.emptySortedMap();
    private SortedMap<Integer, Channel> txChannels = Collections.emptySortedMap();
    private List<Subscription> subscriptions = List.of();

    /**
     * The handle used to talk to the device's control channel, once one has been opened.
     */
    private DeviceControl control;

    /**
     * Create a device record with nothing known about it yet but its host name.
     *
     * @param serverName the normalized host name
     */
    @API(status = API.Status.STABLE)
    public DanteDevice(String serverName) {
        this.serverName = serverName;
    }

    /**
     * Get the normalized host name of the device.
     *
     * @return the host name without any {@code .local} suffix
     */
    @API(status = API.Status.STABLE)
    public String getServerName() {
        return serverName;
    }

    /**
     * Get the display name of the device. This is the name configured on the device if it told us one, otherwise
     * the host name.
     *
     * @return the name by which the device should be known
     */
    @API(status = API.Status.STABLE)
    public String getName() {
        return (name == null || name.isEmpty())? serverName : name;
    }

    /**
     * Get the IPv4 address of the device.
     *
     * @return the address in dotted-quad form, or {@code null} if none was resolved
     */
    @API(status = API.Status.STABLE)
    public String getIpv4() {
        return ipv4;
    }

    /**
     * Get the MAC address advertised by the control and monitoring service.
     *
     * @return the MAC address, or {@code null} if that service was not seen
     */
    @API(status = API.Status.STABLE)
    public String getMacAddress() {
        return macAddress;
    }

    /**
     * Get the model identifier advertised over mDNS, such as {@code DAI2}.
     *
     * @return the model identifier, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public String getModelId() {
        return modelId;
    }

    /**
     * Get the model name reported by the control channel.
     *
     * @return the model name, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public String getModel() {
        return model;
    }

    /**
     * Get the manufacturer reported by the control channel.
     *
     * @return the manufacturer, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public String getManufacturer() {
        return manufacturer;
    }

    /**
     * Get the software running the device, when it is not dedicated hardware (for example {@code Dante Via}).
     *
     * @return the software description, or {@code null}
     */
    @API(status = API.Status.STABLE)
    public String getSoftware() {
        return software;
    }

    /**
     * Get the sample rate advertised by the device.
     *
     * @return the sample rate in hertz, or {@code null} if unknown
     */
    @API(status = API.Status.STABLE)
    public Integer getSampleRate() {
        return sampleRate;
    }

    /**
     * Get the receive latency advertised by the device.
     *
     * @return the latency in nanoseconds, or {@code null} if unknown
     */
    @API(status = API.Status.STABLE)
    public Long getLatencyNs() {
        return latencyNs;
    }

    /**
     * Get the number of receive channels the device has.
     *
     * @return the receive channel count
     */
    @API(status = API.Status.STABLE)
    public int getRxCount() {
        return rxCount;
    }

    /**
     * Get the number of transmit channels the device has.
     *
     * @return the transmit channel count
     */
    @API(status = API.Status.STABLE)
    public int getTxCount() {
        return txCount;
    }

    /**
     * Get the service records which were merged into this device.
     *
     * @return an unmodifiable view of the records, keyed by instance name
     */
    @API(status = API.Status.STABLE)
    public Map<String, ServiceRecord> getServices() {
        return Collections.unmodifiableMap(services);
    }

    /**
     * Get the receive channels of the device.
     *
     * @return the channels, keyed by channel number
     */
    @API(status = API.Status.STABLE)
    public SortedMap<Integer, Channel> getRxChannels() {
        return rxChannels;
    }

    /**
     * Get the transmit channels of the device.
     *
     * @return the channels, keyed by channel number
     */
    @API(status = API.Status.STABLE)
    public SortedMap<Integer, Channel> getTxChannels() {
        return txChannels;
    }

    /**
     * Get the subscriptions the device reported for its receive channels.
     *
     * @return the subscriptions, in the order the device reported them
     */
    @API(status = API.Status.STABLE)
    public List<Subscription> getSubscriptions() {
        return subscriptions;
    }

    /**
     * Look up a receive channel by name.
     *
     * @param channelName the name of the channel
     *
     * @return the lowest-numbered receive channel with that name, or {@code null} if there is none
     */
    @API(status = API.Status.STABLE)
    public Channel findRxChannel(String channelName) {
        for (Channel channel : rxChannels.values()) {
            if (channel.name.equals(channelName)) {
                return channel;
            }
        }
        return null;
    }

    /**
     * Look up a transmit channel by name.
     *
     * @param channelName the name of the channel
     *
     * @return the lowest-numbered transmit channel with that name, or {@code null} if there is none
     */
    @API(status = API.Status.STABLE)
    public Channel findTxChannel(String channelName) {
        for (Channel channel : txChannels.values()) {
            if (channel.name.equals(channelName)) {
                return channel;
            }
        }
        return null;
    }

    /**
     * Get the handle for talking to the device's control channel.
     *
     * @return the control handle, or {@code null} if none has been opened
     */
    @API(status = API.Status.STABLE)
    public DeviceControl getControl() {
        return control;
    }

    void addService(ServiceRecord record) {
        services.put(record.getInstanceName(), record);
    }

    void setIpv4(String ipv4) {
        this.ipv4 = ipv4;
    }

    void setMacAddress(String macAddress) {
        this.macAddress = macAddress;
    }

    void setModelId(String modelId) {
        this.modelId = modelId;
    }

    void setSoftware(String software) {
        this.software = software;
    }

    void setSampleRate(Integer sampleRate) {
        this.sampleRate = sampleRate;
    }

    void setLatencyNs(Long latencyNs) {
        this.latencyNs = latencyNs;
    }

    void setControl(DeviceControl control) {
        this.control = control;
    }

    /**
     * Fold in what the device reported over its control channel. Fields it did not report keep the values
     * learned from mDNS.
     *
     * @param controls the control channel report
     */
    void applyControls(DeviceControls controls) {
        if (controls.name != null && !controls.name.isEmpty()) {
            name = controls.name;
        }
        if (controls.manufacturer != null) {
            manufacturer = controls.manufacturer;
        }
        if (controls.model != null) {
            model = controls.model;
        }
        if (controls.software != null) {
            software = controls.software;
        }
        rxChannels = Collections.unmodifiableSortedMap(new TreeMap<>(controls.rxChannels));
        txChannels = Collections.unmodifiableSortedMap(new TreeMap<>(controls.txChannels));
        subscriptions = controls.subscriptions;
        rxCount = rxChannels.size();
        txCount = txChannels.size();
    }

    @Override
    public String toString() {
        return "DanteDevice[name:" + getName() + ", server:" + serverName + ", ipv4:" + ipv4 + ", mac:" + macAddress +
                ", model:" + modelId + ", sampleRate:" + sampleRate + ", latencyNs:" + latencyNs +
                ", rx:" + rxCount + ", tx:" + txCount + "]";
    }
}
