package org.deepsymmetry.dantelink.control;

import org.apiguardian.api.API;

import java.util.List;
import java.util.Map;

/**
 * The values that Dante devices accept for their configurable settings, along with the labels used to present
 * them.
 */
@API(status = API.Status.STABLE)
public class DeviceSettings {

    /**
     * The sample rates a device can be set to, in hertz.
     */
    @API(status = API.Status.STABLE)
    public static final List<Integer> SAMPLE_RATES = List.of(44100, 48000, 88200, 96000, 176400, 192000);

    /**
     * Human-oriented labels for the sample rates.
     */
    @API(status = API.Status.STABLE)
    public static final Map<Integer, String> SAMPLE_RATE_LABELS = Map.of(
            44100, "44.1 kHz",
            48000, "48 kHz",
            88200, "88.2 kHz",
            96000, "96 kHz",
            176400, "176.4 kHz",
            192000, "192 kHz");

    /**
     * The PCM bit depths a device can be set to.
     */
    @API(status = API.Status.STABLE)
    public static final List<Integer> ENCODINGS = List.of(16, 24, 32);

    /**
     * Labels for the encodings.
     */
    @API(status = API.Status.STABLE)
    public static final Map<Integer, String> ENCODING_LABELS = Map.of(
            16, "PCM 16-bit",
            24, "PCM 24-bit",
            32, "PCM 32-bit");

    /**
     * The lowest gain level an AVIO adapter accepts.
     */
    @API(status = API.Status.STABLE)
    public static final int MINIMUM_GAIN_LEVEL = 1;

    /**
     * The highest gain level an AVIO adapter accepts.
     */
    @API(status = API.Status.STABLE)
    public static final int MAXIMUM_GAIN_LEVEL = 5;

    private static final Map<Integer, String> GAIN_LABELS_INPUT = Map.of(
            1, "+24 dBu",
            2, "+4 dBu",
            3, "+0 dBu",
            4, "0 dBV",
            5, "-10 dBV");

    private static final Map<Integer, String> GAIN_LABELS_OUTPUT = Map.of(
            1, "+18 dBu",
            2, "+4 dBu",
            3, "+0 dBu",
            4, "0 dBV",
            5, "-10 dBV");

    /**
     * Model identifiers of the AVIO analog input adapters.
     */
    @API(status = API.Status.STABLE)
    public static final List<String> AVIO_INPUT_MODELS = List.of("DAI1", "DAI2");

    /**
     * Model identifiers of the AVIO analog output adapters.
     */
    @API(status = API.Status.STABLE)
    public static final List<String> AVIO_OUTPUT_MODELS = List.of("DAO1", "DAO2");

    /**
     * Get the labels describing what each gain level means.
     *
     * @param direction whether we are talking about an input or output adapter
     *
     * @return the labels, keyed by gain level
     */
    @API(status = API.Status.STABLE)
    public static Map<Integer, String> gainLabels(GainDirection direction) {
        return (direction == GainDirection.INPUT)? GAIN_LABELS_INPUT : GAIN_LABELS_OUTPUT;
    }

    /**
     * Figure out whether a device is an AVIO adapter with adjustable gain, based on its model identifier.
     *
     * @param modelId the model identifier advertised over mDNS
     *
     * @return the kind of adapter, or {@code null} if the model has no adjustable gain
     */
    @API(status = API.Status.STABLE)
    public static GainDirection gainDirectionForModel(String modelId) {
        if (modelId == null) {
            return null;
        }
        if (AVIO_INPUT_MODELS.contains(modelId)) {
            return GainDirection.INPUT;
        }
        if (AVIO_OUTPUT_MODELS.contains(modelId)) {
            return GainDirection.OUTPUT;
        }
        return null;
    }

    /**
     * Prevent instantiation.
     */
    private DeviceSettings() {
        // Nothing to do.
    }
}
