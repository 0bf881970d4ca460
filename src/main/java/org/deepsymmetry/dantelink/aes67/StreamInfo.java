package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes one AES67 stream, as announced by a SAP packet carrying an SDP session description. Instances are
 * immutable.
 */
@API(status = API.Status.STABLE)
public class StreamInfo {

    /**
     * The most channels a stream can have and still be subscribed to, since the subscribe command carries the
     * count in a single byte.
     */
    @API(status = API.Status.STABLE)
    public static final int MAXIMUM_CHANNEL_COUNT = 255;

    /**
     * The session name from the {@code s=} line, which uniquely identifies the stream.
     */
    private final String sessionName;

    /**
     * The numeric session id from the {@code o=} line, if it was well-formed.
     */
    private final Long sessionId;

    /**
     * The address of the host originating the stream, from the {@code o=} line.
     */
    private final String originIp;

    /**
     * The multicast group carrying the stream, from the {@code c=} line, without any TTL suffix.
     */
    private final String multicastAddr;

    /**
     * The RTP port of the stream, from the {@code m=} line.
     */
    private final Integer port;

    /**
     * The encoding, such as {@code L24/48000/2}, from the {@code a=rtpmap:} line.
     */
    private final String codec;

    /**
     * The number of audio channels in the stream.
     */
    private final int channelCount;

    /**
     * The raw session information ({@code i=}) line, which often names the channels.
     */
    private final String channelInfo;

    /**
     * The channel names, derived once when first needed.
     */
    private volatile List<String> channelNames;

    /**
     * Constructor simply sets all the immutable fields.
     *
     * @param sessionName the session name, required
     * @param sessionId the numeric session id, may be {@code null}
     * @param originIp the originating host address, may be {@code null}
     * @param multicastAddr the multicast group address, may be {@code null}
     * @param port the RTP port, may be {@code null}
     * @param codec the encoding description, may be {@code null}
     * @param channelCount the number of channels, from 1 to {@link #MAXIMUM_CHANNEL_COUNT}
     * @param channelInfo the session information text, may be {@code null}
     */
    @API(status = API.Status.STABLE)
    public StreamInfo(String sessionName, Long sessionId, String originIp, String multicastAddr, Integer port,
                      String codec, int channelCount, String channelInfo) {
        this.sessionName = Objects.requireNonNull(sessionName, "sessionName");
        if (channelCount < 1 || channelCount > MAXIMUM_CHANNEL_COUNT) {
            throw new IllegalArgumentException("A stream must have between 1 and " + MAXIMUM_CHANNEL_COUNT +
                    " channels, got " + channelCount);
        }
        this.sessionId = sessionId;
        this.originIp = originIp;
        this.multicastAddr = multicastAddr;
        this.port = port;
        this.codec = codec;
        this.channelCount = channelCount;
        this.channelInfo = channelInfo;
    }

    @API(status = API.Status.STABLE)
    public String getSessionName() {
        return sessionName;
    }

    @API(status = API.Status.STABLE)
    public Long getSessionId() {
        return sessionId;
    }

    @API(status = API.Status.STABLE)
    public String getOriginIp() {
        return originIp;
    }

    @API(status = API.Status.STABLE)
    public String getMulticastAddr() {
        return multicastAddr;
    }

    @API(status = API.Status.STABLE)
    public Integer getPort() {
        return port;
    }

    @API(status = API.Status.STABLE)
    public String getCodec() {
        return codec;
    }

    @API(status = API.Status.STABLE)
    public int getChannelCount() {
        return channelCount;
    }

    @API(status = API.Status.STABLE)
    public String getChannelInfo() {
        return channelInfo;
    }

    /**
     * Get the encoding name part of the codec description, such as {@code L24}.
     *
     * @return the text before the first slash of the codec, or {@code null} if no codec was announced
     */
    @API(status = API.Status.STABLE)
    public String getEncodingName() {
        if (codec == null || codec.isEmpty()) {
            return null;
        }
        final int slash = codec.indexOf('/');
        return (slash < 0)? codec : codec.substring(0, slash);
    }

    /**
     * <p>Get the names of the individual channels in the stream, in channel order.</p>
     *
     * <p>Many senders list the channel names in the session information line, like
     * {@code i=2 channels: Tx Left, Tx Right}. If the comma-separated list after the first colon has exactly
     * as many entries as the stream has channels, those are the names. Otherwise generic names are used:
     * {@code Mono} for one channel, {@code Left} and {@code Right} for two, and {@code Ch1} through
     * {@code ChN} beyond that.</p>
     *
     * @return the channel names
     */
    @API(status = API.Status.STABLE)
    public List<String> getChannelNames() {
        List<String> result = channelNames;
        if (result == null) {
            result = deriveChannelNames();
            channelNames = result;
        }
        return result;
    }

    /**
     * Work out the channel names as described in {@link #getChannelNames()}.
     *
     * @return the unmodifiable list of names
     */
    private List<String> deriveChannelNames() {
        if (channelInfo != null) {
            final int colon = channelInfo.indexOf(':');
            if (colon >= 0) {
                final List<String> names = new ArrayList<>();
                for (String candidate : channelInfo.substring(colon + 1).split(",")) {
                    final String trimmed = candidate.trim();
                    if (!trimmed.isEmpty()) {
                        names.add(trimmed);
                    }
                }
                if (names.size() == channelCount) {
                    return Collections.unmodifiableList(names);
                }
            }
        }

        if (channelCount == 1) {
            return List.of("Mono");
        }
        if (channelCount == 2) {
            return List.of("Left", "Right");
        }
        final List<String> generic = new ArrayList<>(channelCount);
        for (int i = 1; i <= channelCount; i++) {
            generic.add("Ch" + i);
        }
        return Collections.unmodifiableList(generic);
    }

    @Override
    public String toString() {
        return "StreamInfo[session:" + sessionName + ", id:" + sessionId + ", origin:" + originIp +
                ", multicast:" + multicastAddr + ", port:" + port + ", codec:" + codec +
                ", channels:" + channelCount + "]";
    }
}
