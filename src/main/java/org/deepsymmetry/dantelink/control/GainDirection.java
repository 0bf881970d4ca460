package org.deepsymmetry.dantelink.control;

import org.apiguardian.api.API;

/**
 * Distinguishes the two kinds of AVIO analog adapters, whose gain levels mean different things.
 */
@API(status = API.Status.STABLE)
public enum GainDirection {

    /**
     * An analog-to-Dante adapter, whose gain setting is an input sensitivity.
     */
    INPUT("input"),

    /**
     * A Dante-to-analog adapter, whose gain setting is an output level.
     */
    OUTPUT("output");

    /**
     * The name by which the control protocol refers to this direction.
     */
    public final String protocolName;

    GainDirection(String protocolName) {
        this.protocolName = protocolName;
    }
}
