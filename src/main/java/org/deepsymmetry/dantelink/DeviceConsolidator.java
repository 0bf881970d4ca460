package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>Groups the service records found during a discovery pass by the host which advertised them, and builds a
 * {@link DanteDevice} for each host from the union of its records' properties.</p>
 *
 * <p>Records are merged in the order they are given. When two records for the same host carry the same
 * property with different values, whichever record comes later wins. The order in which mDNS delivers services
 * is not meaningful, so neither is the choice between conflicting values; no record type takes precedence over
 * another except where noted below.</p>
 */
@API(status = API.Status.STABLE)
public class DeviceConsolidator {

    private static final Logger logger = LoggerFactory.getLogger(DeviceConsolidator.class);

    /**
     * The exact value of the {@code router_info} property advertised by the Dante Via software, quotes included.
     */
    static final String DANTE_VIA_ROUTER_INFO = "\"Dante Via\"";

    /**
     * The software description we record for devices that turn out to be Dante Via.
     */
    @API(status = API.Status.STABLE)
    public static final String DANTE_VIA = "Dante Via";

    /**
     * Build the devices described by a set of service records.
     *
     * @param records the service records resolved during a discovery pass
     *
     * @return the devices, keyed by normalized host name, in the order each host was first seen
     */
    @API(status = API.Status.STABLE)
    public Map<String, DanteDevice> consolidate(List<ServiceRecord> records) {
        final Map<String, DanteDevice> result = new LinkedHashMap<>();
        for (ServiceRecord record : records) {
            final DanteDevice device = result.computeIfAbsent(record.getServerName(), DanteDevice::new);
            device.addService(record);
            try {
                merge(device, record);
            } catch (Exception e) {
                logger.warn("Problem merging {} into device {}, skipping it", record.getInstanceName(),
                        record.getServerName(), e);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Apply the properties of one service record to the device it belongs to. Each property is handled
     * separately, so a malformed number only loses that one value.
     *
     * @param device the device being built
     * @param record the service record to fold in
     */
    private void merge(DanteDevice device, ServiceRecord record) {
        final Map<String, String> properties = record.getProperties();

        if (device.getIpv4() == null || device.getIpv4().isEmpty()) {
            device.setIpv4(record.getIpv4());
        }
        if (Util.SERVICE_CMC.equals(record.getServiceType()) && properties.containsKey("id")) {
            device.setMacAddress(properties.get("id"));
        }
        if (properties.containsKey("model")) {
            device.setModelId(properties.get("model"));
        }
        if (properties.containsKey("rate")) {
            final Long rate = parseNumber(properties.get("rate"));
            if (rate != null && rate <= Integer.MAX_VALUE) {
                device.setSampleRate(rate.intValue());
            } else {
                logger.debug("Ignoring malformed rate {} from {}", properties.get("rate"), record.getInstanceName());
            }
        }
        if (properties.containsKey("latency_ns")) {
            final Long latency = parseNumber(properties.get("latency_ns"));
            if (latency != null) {
                device.setLatencyNs(latency);
            } else {
                logger.debug("Ignoring malformed latency_ns {} from {}", properties.get("latency_ns"),
                        record.getInstanceName());
            }
        }
        if (DANTE_VIA_ROUTER_INFO.equals(properties.get("router_info"))) {
            device.setSoftware(DANTE_VIA);
        }
    }

    /**
     * Parse a property value as a whole number.
     *
     * @param value the property value
     *
     * @return the number, or {@code null} if the value was missing or not an integer
     */
    private static Long parseNumber(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
