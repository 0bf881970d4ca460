package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.aes67.StreamCache;
import org.deepsymmetry.dantelink.aes67.StreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>Recovers AES67 source selections from the subscriptions devices report.</p>
 *
 * <p>A Dante device remembers its AES67 subscriptions across restarts of this library, but reports them only as
 * an address in the transmitting device field and a channel name or number in the transmitting channel field. This
 * class matches that address against the origin and multicast addresses of the streams we have heard announced,
 * and records a {@code [AES67] Stream - Channel} label for each receive channel it can account for. Only channels
 * with no recorded selection get one; selections made at runtime are left alone.</p>
 */
@API(status = API.Status.STABLE)
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    /**
     * The prefix which identifies source labels that name an AES67 stream channel rather than a Dante channel.
     */
    @API(status = API.Status.STABLE)
    public static final String AES67_PREFIX = "[AES67] ";

    /**
     * Separates the stream (or device) name from the channel name in a source label.
     */
    @API(status = API.Status.STABLE)
    public static final String LABEL_SEPARATOR = " - ";

    /**
     * Build the label that identifies a channel of an AES67 stream as a source.
     *
     * @param sessionName the name of the stream
     * @param channelName the name of the channel within the stream
     *
     * @return the source label
     */
    @API(status = API.Status.STABLE)
    public static String aes67Label(String sessionName, String channelName) {
        return AES67_PREFIX + sessionName + LABEL_SEPARATOR + channelName;
    }

    /**
     * Pair of a stream and the name it is cached under.
     */
    private static class NamedStream {
        final String name;
        final StreamInfo stream;

        NamedStream(String name, StreamInfo stream) {
            this.name = name;
            this.stream = stream;
        }
    }

    /**
     * Record selections for every AES67 subscription we can match to a known stream, where no selection is
     * recorded yet.
     *
     * @param devices the devices found by the latest refresh pass, keyed by display name
     * @param streams the streams heard so far
     * @param selections where selections are recorded
     *
     * @return the number of selections added
     */
    @API(status = API.Status.STABLE)
    public int reconcile(Map<String, DanteDevice> devices, StreamCache streams, SourceSelections selections) {
        if (streams.isEmpty()) {
            return 0;
        }
        final Map<String, NamedStream> byOrigin = new HashMap<>();
        final Map<String, NamedStream> byMulticast = new HashMap<>();
        for (Map.Entry<String, StreamInfo> entry : streams.getStreams().entrySet()) {
            final NamedStream named = new NamedStream(entry.getKey(), entry.getValue());
            if (isPresent(entry.getValue().getOriginIp())) {
                byOrigin.put(entry.getValue().getOriginIp(), named);
            }
            if (isPresent(entry.getValue().getMulticastAddr())) {
                byMulticast.put(entry.getValue().getMulticastAddr(), named);
            }
        }

        int added = 0;
        for (Map.Entry<String, DanteDevice> entry : devices.entrySet()) {
            final String deviceName = entry.getKey();
            final DanteDevice device = entry.getValue();
            for (Subscription subscription : device.getSubscriptions()) {
                if (subscription.txDeviceName == null) {
                    continue;
                }
                NamedStream match = byOrigin.get(subscription.txDeviceName);
                if (match == null) {
                    match = byMulticast.get(subscription.txDeviceName);
                }
                if (match == null) {
                    continue;  // An ordinary Dante subscription.
                }
                final Channel rxChannel = device.findRxChannel(subscription.rxChannelName);
                if (rxChannel == null) {
                    logger.debug("No receive channel named {} on {}, cannot reconcile {}",
                            subscription.rxChannelName, deviceName, subscription);
                    continue;
                }
                final String label = aes67Label(match.name,
                        channelLabel(match.stream.getChannelNames(), subscription.txChannelName));
                if (selections.putIfAbsent(new SelectionKey(deviceName, rxChannel.number), label)) {
                    added++;
                    logger.debug("Reconciled AES67 subscription: {} channel {} -> {}",
                            deviceName, rxChannel.number, label);
                }
            }
        }
        if (added > 0) {
            logger.info("Reconciled {} AES67 subscription(s) from device state", added);
        }
        return added;
    }

    /**
     * Work out which channel of a stream a subscription refers to. A device may report the channel by name or by
     * its 1-based position; anything else is taken to mean the first channel.
     *
     * @param channelNames the derived channel names of the stream
     * @param txChannelName what the device reported as the transmitting channel
     *
     * @return the channel name to use in the label
     */
    static String channelLabel(List<String> channelNames, String txChannelName) {
        if (txChannelName != null) {
            if (channelNames.contains(txChannelName)) {
                return txChannelName;
            }
            final int index = parseIndex(txChannelName);
            if (index >= 1 && index <= channelNames.size()) {
                return channelNames.get(index - 1);
            }
        }
        return channelNames.get(0);
    }

    /**
     * Parse a channel position, returning -1 if the text is not a number.
     */
    private static int parseIndex(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
