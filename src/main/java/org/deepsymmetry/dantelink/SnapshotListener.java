package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

import java.util.Map;

/**
 * The listener interface for receiving the device snapshots published at the end of each successful refresh
 * pass. Listeners are called on the refresh thread, so they should hand off anything slow.
 */
@API(status = API.Status.STABLE)
public interface SnapshotListener {

    /**
     * Invoked when a refresh pass has published a new snapshot of the network.
     *
     * @param devices the devices found, keyed by display name; the map and the devices in it are not changed
     *                after publication
     */
    @API(status = API.Status.STABLE)
    void snapshotUpdated(Map<String, DanteDevice> devices);
}
