package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;

import java.util.Objects;

/**
 * An audio channel offered by a Dante device, either for receiving (an rx channel) or transmitting (a tx channel).
 */
@API(status = API.Status.STABLE)
public class Channel {

    /**
     * The channel number, starting at 1.
     */
    @API(status = API.Status.STABLE)
    public final int number;

    /**
     * The name of the channel, as currently configured on the device.
     */
    @API(status = API.Status.STABLE)
    public final String name;

    /**
     * Create a channel.
     *
     * @param number the channel number, starting at 1
     * @param name the channel name
     */
    @API(status = API.Status.STABLE)
    public Channel(int number, String name) {
        if (number < 1) {
            throw new IllegalArgumentException("Channel numbers start at 1, got " + number);
        }
        this.number = number;
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Channel && ((Channel) obj).number == number && ((Channel) obj).name.equals(name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, name);
    }

    @Override
    public String toString() {
        return "Channel[number:" + number + ", name:" + name + "]";
    }
}
