package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents one resolved mDNS service instance advertised by a Dante device. A single physical device normally
 * advertises several of these, which the {@link DeviceConsolidator} merges into one {@link DanteDevice}.
 * Service records are only meaningful within the discovery pass that resolved them.
 */
@API(status = API.Status.STABLE)
public class ServiceRecord {

    /**
     * The service type, such as {@link Util#SERVICE_CMC}.
     */
    private final String serviceType;

    /**
     * The full name of the service instance.
     */
    private final String instanceName;

    /**
     * The IPv4 address the service resolved to, in dotted-quad form.
     */
    private final String ipv4;

    /**
     * The port on which the service is offered.
     */
    private final int port;

    /**
     * The host name of the device, already normalized by {@link Util#normalizeServerName(String)}.
     */
    private final String serverName;

    /**
     * The decoded text record properties.
     */
    private final Map<String, String> properties;

    /**
     * Constructor simply sets all the immutable fields. The server name is normalized, so it can be used as the
     * key which groups records belonging to the same device.
     *
     * @param serviceType the service type
     * @param instanceName the full instance name
     * @param ipv4 the resolved address, may be {@code null}
     * @param port the service port
     * @param serverName the host name reported for the service; if {@code null}, derived from the instance name
     * @param properties the text record properties, keys are case-sensitive
     */
    @API(status = API.Status.STABLE)
    public ServiceRecord(String serviceType, String instanceName, String ipv4, int port, String serverName,
                         Map<String, String> properties) {
        this.serviceType = Objects.requireNonNull(serviceType, "serviceType");
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
        this.ipv4 = ipv4;
        this.port = port;
        final String rawServer = (serverName == null || serverName.isEmpty())?
                Util.serverNameFromInstance(instanceName) : serverName;
        this.serverName = Util.normalizeServerName(rawServer);
        this.properties = (properties == null)? Collections.emptyMap() :
                Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Get the type of this service.
     *
     * @return the mDNS service type, including the trailing {@code .local.}
     */
    @API(status = API.Status.STABLE)
    public String getServiceType() {
        return serviceType;
    }

    /**
     * Get the name of this service instance.
     *
     * @return the full instance name
     */
    @API(status = API.Status.STABLE)
    public String getInstanceName() {
        return instanceName;
    }

    /**
     * Get the address to which the service resolved.
     *
     * @return the IPv4 address, or {@code null} if none was resolved
     */
    @API(status = API.Status.STABLE)
    public String getIpv4() {
        return ipv4;
    }

    /**
     * Get the port on which the service is offered.
     *
     * @return the port number
     */
    @API(status = API.Status.STABLE)
    public int getPort() {
        return port;
    }

    /**
     * Get the normalized host name of the device offering this service.
     *
     * @return the host name with any trailing dot and {@code .local} suffix removed
     */
    @API(status = API.Status.STABLE)
    public String getServerName() {
        return serverName;
    }

    /**
     * Get the text record properties of the service. Values are returned exactly as advertised, so some of them
     * may still carry surrounding quotation marks.
     *
     * @return an unmodifiable map of property names to values
     */
    @API(status = API.Status.STABLE)
    public Map<String, String> getProperties() {
        return properties;
    }

    @Override
    public String toString() {
        return "ServiceRecord[type:" + serviceType + ", name:" + instanceName + ", server:" + serverName +
                ", ipv4:" + ipv4 + ", port:" + port + ", properties:" + properties + "]";
    }
}
