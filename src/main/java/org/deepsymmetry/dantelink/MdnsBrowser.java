package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Finds and resolves the mDNS services advertised by Dante devices.
 */
@API(status = API.Status.STABLE)
public interface MdnsBrowser {

    /**
     * Browse for services of the specified types for a bounded window of time, then resolve everything that was
     * seen. Services which cannot be resolved, or which resolve without an address, are left out of the result;
     * they never cause the whole browse to fail.
     *
     * @param serviceTypes the service types to browse for
     * @param windowMillis how long to listen for service announcements
     *
     * @return the resolved service records
     *
     * @throws IOException if the multicast DNS facility itself cannot be used
     */
    @API(status = API.Status.STABLE)
    List<ServiceRecord> browse(Collection<String> serviceTypes, long windowMillis) throws IOException;
}
