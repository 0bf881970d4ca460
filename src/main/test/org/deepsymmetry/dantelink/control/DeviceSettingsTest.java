package org.deepsymmetry.dantelink.control;

import org.junit.Test;

import static org.junit.Assert.*;

public class DeviceSettingsTest {

    @Test
    public void everySettingHasALabel() {
        for (int rate : DeviceSettings.SAMPLE_RATES) {
            assertNotNull(DeviceSettings.SAMPLE_RATE_LABELS.get(rate));
        }
        for (int bits : DeviceSettings.ENCODINGS) {
            assertNotNull(DeviceSettings.ENCODING_LABELS.get(bits));
        }
        for (GainDirection direction : GainDirection.values()) {
            for (int level = DeviceSettings.MINIMUM_GAIN_LEVEL; level <= DeviceSettings.MAXIMUM_GAIN_LEVEL; level++) {
                assertNotNull(DeviceSettings.gainLabels(direction).get(level));
            }
        }
        assertEquals("48 kHz", DeviceSettings.SAMPLE_RATE_LABELS.get(48000));
        assertEquals("+24 dBu", DeviceSettings.gainLabels(GainDirection.INPUT).get(1));
        assertEquals("+18 dBu", DeviceSettings.gainLabels(GainDirection.OUTPUT).get(1));
    }

    @Test
    public void recognizesAvioModels() {
        assertEquals(GainDirection.INPUT, DeviceSettings.gainDirectionForModel("DAI2"));
        assertEquals(GainDirection.OUTPUT, DeviceSettings.gainDirectionForModel("DAO1"));
        assertNull(DeviceSettings.gainDirectionForModel("DVS"));
        assertNull(DeviceSettings.gainDirectionForModel(null));
    }
}
