package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.jmdns.JmDNS;
import javax.jmdns.ServiceEvent;
import javax.jmdns.ServiceInfo;
import javax.jmdns.ServiceListener;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Browses for Dante services using JmDNS. A fresh JmDNS instance is created for each browse and closed
 * afterwards, so nothing is left listening between refresh passes.
 */
@API(status = API.Status.STABLE)
public class JmdnsBrowser implements MdnsBrowser {

    private static final Logger logger = LoggerFactory.getLogger(JmdnsBrowser.class);

    /**
     * The default number of milliseconds we will wait for a single service to resolve.
     */
    @API(status = API.Status.STABLE)
    public static final int DEFAULT_RESOLVE_TIMEOUT = 3000;

    /**
     * How long we will wait for a single service to resolve.
     */
    private final AtomicInteger resolveTimeout = new AtomicInteger(DEFAULT_RESOLVE_TIMEOUT);

    /**
     * The local address on which to run mDNS, or {@code null} to let JmDNS choose.
     */
    private final InetAddress bindAddress;

    /**
     * Create a browser which lets JmDNS pick the network interface.
     */
    @API(status = API.Status.STABLE)
    public JmdnsBrowser() {
        this(null);
    }

    /**
     * Create a browser which runs mDNS on a specific local address.
     *
     * @param bindAddress the local address of the interface facing the Dante network
     */
    @API(status = API.Status.STABLE)
    public JmdnsBrowser(InetAddress bindAddress) {
        this.bindAddress = bindAddress;
    }

    /**
     * Set how long we will wait for each service to resolve.
     *
     * @param timeout the number of milliseconds after which an unresolved service is given up on
     */
    @API(status = API.Status.STABLE)
    public void setResolveTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("Resolve timeout must be positive");
        }
        resolveTimeout.set(timeout);
    }

    /**
     * Check how long we will wait for each service to resolve.
     *
     * @return the number of milliseconds after which an unresolved service is given up on
     */
    @API(status = API.Status.STABLE)
    public int getResolveTimeout() {
        return resolveTimeout.get();
    }

    @Override
    public List<ServiceRecord> browse(Collection<String> serviceTypes, long windowMillis) throws IOException {
        final JmDNS jmdns = (bindAddress == null)? JmDNS.create() : JmDNS.create(bindAddress);
        try {
            final Set<Map.Entry<String, String>> found = Collections.synchronizedSet(new LinkedHashSet<>());
            final ServiceListener listener = new ServiceListener() {
                @Override
                public void serviceAdded(ServiceEvent event) {
                    found.add(Map.entry(event.getType(), event.getName()));
                }

                @Override
                public void serviceRemoved(ServiceEvent event) {
                    // We rebuild everything each pass, so departures need no handling.
                }

                @Override
                public void serviceResolved(ServiceEvent event) {
                    // Resolution happens explicitly once the browse window closes.
                }
            };

            for (String type : serviceTypes) {
                jmdns.addServiceListener(type, listener);
            }
            try {
                Thread.sleep(windowMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while browsing for mDNS services");
            } finally {
                for (String type : serviceTypes) {
                    jmdns.removeServiceListener(type, listener);
                }
            }

            final List<Map.Entry<String, String>> toResolve;
            synchronized (found) {
                toResolve = new ArrayList<>(found);
            }
            logger.debug("Found {} raw services", toResolve.size());

            final List<ServiceRecord> result = new ArrayList<>();
            for (Map.Entry<String, String> service : toResolve) {
                final ServiceRecord record = resolve(jmdns, service.getKey(), service.getValue());
                if (record != null) {
                    result.add(record);
                }
            }
            return result;
        } finally {
            jmdns.close();
        }
    }

    /**
     * Try to resolve a single service that was seen while browsing.
     *
     * @param jmdns the mDNS instance that saw the service
     * @param type the service type
     * @param name the service instance name
     *
     * @return the resolved record, or {@code null} if it could not be resolved to an IPv4 address
     */
    private ServiceRecord resolve(JmDNS jmdns, String type, String name) {
        try {
            final ServiceInfo info = jmdns.getServiceInfo(type, name, resolveTimeout.get());
            if (info == null) {
                logger.debug("Could not resolve service {} of type {}", name, type);
                return null;
            }
            final Inet4Address[] addresses = info.getInet4Addresses();
            if (addresses == null || addresses.length == 0) {
                logger.debug("Service {} resolved without an IPv4 address, ignoring it", name);
                return null;
            }

            final Map<String, String> properties = new LinkedHashMap<>();
            final Enumeration<String> names = info.getPropertyNames();
            while (names.hasMoreElements()) {
                final String key = names.nextElement();
                final byte[] value = info.getPropertyBytes(key);
                properties.put(key, (value == null)? "" : Util.decodeLossy(value, 0, value.length));
            }

            final String fullName = name + "." + type;
            return new ServiceRecord(type, fullName, addresses[0].getHostAddress(), info.getPort(), info.getServer(),
                    properties);
        } catch (Exception e) {
            logger.debug("Problem resolving service {}", name, e);
            return null;
        }
    }

    @Override
    public String toString() {
        return "JmdnsBrowser[bindAddress:" + bindAddress + ", resolveTimeout:" + resolveTimeout.get() + "]";
    }
}
