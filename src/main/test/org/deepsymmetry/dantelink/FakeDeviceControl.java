package org.deepsymmetry.dantelink;

import org.deepsymmetry.dantelink.control.DeviceControl;
import org.deepsymmetry.dantelink.control.DeviceControls;
import org.deepsymmetry.dantelink.control.GainDirection;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stands in for a device control channel, reporting canned controls and recording the requests made of it.
 */
class FakeDeviceControl implements DeviceControl {

    final DeviceControls controls;
    final boolean aes67Capable;
    final List<String> requests = Collections.synchronizedList(new ArrayList<>());
    volatile boolean failing;

    FakeDeviceControl(DeviceControls controls, boolean aes67Capable) {
        this.controls = controls;
        this.aes67Capable = aes67Capable;
    }

    private void record(String request) throws IOException {
        if (failing) {
            throw new IOException("Device unreachable");
        }
        requests.add(request);
    }

    @Override
    public DeviceControls getControls() throws IOException {
        if (controls == null || failing) {
            throw new IOException("Device did not answer");
        }
        return controls;
    }

    @Override
    public void identify() throws IOException {
        record("identify");
    }

    @Override
    public void setLatency(double milliseconds) throws IOException {
        record("latency " + milliseconds);
    }

    @Override
    public void setSampleRate(int hertz) throws IOException {
        record("rate " + hertz);
    }

    @Override
    public void setEncoding(int bits) throws IOException {
        record("encoding " + bits);
    }

    @Override
    public void setGainLevel(int channel, int level, GainDirection direction) throws IOException {
        record("gain " + channel + " " + level + " " + direction.protocolName);
    }

    @Override
    public void addSubscription(Channel rxChannel, Channel txChannel, String txDeviceName) throws IOException {
        record("subscribe " + rxChannel.number + " " + txDeviceName + ":" + txChannel.name);
    }

    @Override
    public void removeSubscription(Channel rxChannel) throws IOException {
        record("unsubscribe " + rxChannel.number);
    }

    @Override
    public boolean supportsAes67() {
        return aes67Capable;
    }

    @Override
    public void setAes67(boolean enabled) throws IOException {
        if (!aes67Capable) {
            throw new UnsupportedOperationException();
        }
        record("aes67 " + enabled);
    }
}
