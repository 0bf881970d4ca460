package org.deepsymmetry.dantelink.control;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.DanteDevice;

/**
 * Creates the control-channel handles used to talk to devices as they are found. A fresh handle is requested
 * for every device on every refresh pass, since addresses and ports can change between passes.
 */
@API(status = API.Status.STABLE)
@FunctionalInterface
public interface DeviceControlFactory {

    /**
     * Create a handle for talking to a newly discovered device.
     *
     * @param device the device, with its address and advertised services already filled in
     *
     * @return the handle to use for control-channel requests to that device
     */
    @API(status = API.Status.STABLE)
    DeviceControl open(DanteDevice device);
}
