package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.Util;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;

/**
 * <p>Builds the command which tells a Dante device to subscribe one of its receive channels to a channel of an
 * AES67 multicast stream, and interprets the device's acknowledgement.</p>
 *
 * <p>The format was worked out from packet captures of Dante Controller creating such subscriptions, and only a
 * handful of captures have been examined. In particular the encoding byte is known only for the codecs in
 * {@link #ENCODING_BYTES}; streams using anything else are sent the L24 value, which a device may well reject.</p>
 */
@API(status = API.Status.EXPERIMENTAL)
public class SubscribeCommand {

    /**
     * The UDP port on which Dante devices accept this command.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final int COMMAND_PORT = 4440;

    /**
     * The size of every subscribe command frame.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final int FRAME_LENGTH = 112;

    /**
     * The shortest acknowledgement we can interpret.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final int MINIMUM_RESPONSE_LENGTH = 10;

    /**
     * The status value reported by a device which accepted the subscription.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final int STATUS_SUCCESS = 1;

    private static final byte[] REQUEST_MAGIC = {0x28, 0x09};
    private static final byte[] RESPONSE_MAGIC = {0x28, 0x01};
    private static final int COMMAND_CODE = 0x3201;
    private static final int RECORD_TYPE = 0x4202;
    private static final int CONTENT_OFFSET = 0x0068;
    private static final int FLOW_SOURCE_TAG = 0x1000;
    private static final int FLOW_SOURCE_SUBTAG = 0x000b;

    // Offsets within the frame.
    private static final int SEQUENCE_OFFSET = 4;
    private static final int COMMAND_OFFSET = 6;
    private static final int RECORD_TYPE_OFFSET = 18;
    private static final int RECORD_COUNT_OFFSET = 28;
    private static final int CONTENT_OFFSET_OFFSET = 34;
    private static final int FLOW_SOURCE_OFFSET = 64;
    private static final int ORIGIN_ADDRESS_OFFSET = 68;
    private static final int FLOW_ID_OFFSET = 76;
    private static final int CHANNEL_MAP_OFFSET = 96;
    private static final int STATUS_OFFSET = 8;

    /**
     * The encoding byte sent for each known RTP payload encoding.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final Map<String, Integer> ENCODING_BYTES = Map.of(
            "L24", 0x08,
            "L16", 0x06,
            "L32", 0x0a);

    /**
     * The encoding byte we send when the stream's encoding is missing or not in {@link #ENCODING_BYTES}.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final int DEFAULT_ENCODING_BYTE = 0x08;

    /**
     * Look up the encoding byte for a codec description.
     *
     * @param codec the codec, such as {@code L24/48000/2}; may be {@code null}
     *
     * @return the value to send in the encoding byte of the channel mapping
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static int encodingByte(String codec) {
        if (codec == null || codec.isEmpty()) {
            return DEFAULT_ENCODING_BYTE;
        }
        final int slash = codec.indexOf('/');
        final String name = (slash < 0)? codec : codec.substring(0, slash);
        return ENCODING_BYTES.getOrDefault(name, DEFAULT_ENCODING_BYTE);
    }

    /**
     * Build the command frame subscribing a receive channel to a channel of an AES67 stream.
     *
     * @param rxChannel the receive channel number on the Dante device
     * @param flowChannel the 1-based channel within the stream
     * @param stream the stream to subscribe to, which must have an origin address, multicast address, session id
     *               and port
     * @param sequence the transaction sequence number, only the low 16 bits are used
     *
     * @return the 112-byte frame to send to {@link #COMMAND_PORT}
     *
     * @throws IllegalArgumentException if a channel number or port is out of range, or the stream is
     *                                  missing a field we need
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static byte[] encode(int rxChannel, int flowChannel, StreamInfo stream, int sequence) {
        if (rxChannel < 1 || rxChannel > 0xffff) {
            throw new IllegalArgumentException("rxChannel must be between 1 and 65535, got " + rxChannel);
        }
        if (flowChannel < 1 || flowChannel > 0xff) {
            throw new IllegalArgumentException("flowChannel must be between 1 and 255, got " + flowChannel);
        }
        if (stream.getSessionId() == null) {
            throw new IllegalArgumentException("Stream " + stream.getSessionName() + " has no session id");
        }
        if (stream.getPort() == null) {
            throw new IllegalArgumentException("Stream " + stream.getSessionName() + " has no RTP port");
        }
        if (stream.getPort() < 1 || stream.getPort() > 0xffff) {
            throw new IllegalArgumentException("Stream " + stream.getSessionName() + " has invalid RTP port " +
                    stream.getPort());
        }
        final byte[] origin = ipv4Bytes(stream.getOriginIp(), "origin", stream);
        final byte[] multicast = ipv4Bytes(stream.getMulticastAddr(), "multicast", stream);
        final int channels = stream.getChannelCount();

        final byte[] frame = new byte[FRAME_LENGTH];

        // Header
        System.arraycopy(REQUEST_MAGIC, 0, frame, 0, REQUEST_MAGIC.length);
        Util.numberToBytes(FRAME_LENGTH, frame, 2, 2);
        Util.numberToBytes(sequence, frame, SEQUENCE_OFFSET, 2);
        Util.numberToBytes(COMMAND_CODE, frame, COMMAND_OFFSET, 2);
        frame[10] = 0x01;  // Protocol and version flags, as captured.
        frame[11] = 0x01;
        frame[12] = 0x00;
        frame[13] = 0x10;

        Util.numberToBytes(RECORD_TYPE, frame, RECORD_TYPE_OFFSET, 2);
        Util.numberToBytes(1, frame, RECORD_COUNT_OFFSET, 2);
        Util.numberToBytes(CONTENT_OFFSET, frame, CONTENT_OFFSET_OFFSET, 2);

        // Sub-record descriptors.
        Util.numberToBytes(0x0003, frame, 44, 2);
        Util.numberToBytes(0x0040, frame, 46, 2);
        Util.numberToBytes(0x0002, frame, 52, 2);
        Util.numberToBytes(0x0060, frame, 54, 2);

        // Flow source: where the stream comes from and which session it is.
        Util.numberToBytes(FLOW_SOURCE_TAG, frame, FLOW_SOURCE_OFFSET, 2);
        Util.numberToBytes(FLOW_SOURCE_SUBTAG, frame, FLOW_SOURCE_OFFSET + 2, 2);
        System.arraycopy(origin, 0, frame, ORIGIN_ADDRESS_OFFSET, 4);
        Util.numberToBytes(stream.getSessionId() & 0xffffffffL, frame, FLOW_ID_OFFSET, 4);

        // Channel mapping.
        Util.numberToBytes(rxChannel, frame, CHANNEL_MAP_OFFSET, 2);
        Util.numberToBytes(channels, frame, CHANNEL_MAP_OFFSET + 2, 2);
        frame[CHANNEL_MAP_OFFSET + 6] = (byte) flowChannel;
        frame[CHANNEL_MAP_OFFSET + 8] = (byte) encodingByte(stream.getCodec());
        frame[CHANNEL_MAP_OFFSET + 9] = (byte) channels;
        Util.numberToBytes(stream.getPort(), frame, CHANNEL_MAP_OFFSET + 10, 2);
        System.arraycopy(multicast, 0, frame, CHANNEL_MAP_OFFSET + 12, 4);

        return frame;
    }

    /**
     * Interpret the acknowledgement a device sent in response to a subscribe command.
     *
     * @param data the buffer holding the response
     * @param length the number of bytes of response in the buffer
     *
     * @return {@link SubscribeResult#success()} if the device reported status 1, a rejection carrying the status
     *         for any other status, or a malformed-response result if the response was not recognizable
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static SubscribeResult decodeResponse(byte[] data, int length) {
        if (length < MINIMUM_RESPONSE_LENGTH || length > data.length) {
            return SubscribeResult.malformed("Response of " + length + " bytes is too short");
        }
        if (data[0] != RESPONSE_MAGIC[0] || data[1] != RESPONSE_MAGIC[1]) {
            return SubscribeResult.malformed(String.format("Response starts with 0x%02x%02x, not 0x2801",
                    data[0], data[1]));
        }
        final int status = (int) Util.bytesToNumber(data, STATUS_OFFSET, 2);
        if (status == STATUS_SUCCESS) {
            return SubscribeResult.success();
        }
        return SubscribeResult.rejected(status);
    }

    /**
     * Convert a dotted-quad address to its four bytes.
     */
    private static byte[] ipv4Bytes(String address, String which, StreamInfo stream) {
        if (address == null || address.isEmpty()) {
            throw new IllegalArgumentException("Stream " + stream.getSessionName() + " has no " + which + " address");
        }
        try {
            final InetAddress parsed = InetAddress.getByName(address);
            if (!(parsed instanceof Inet4Address)) {
                throw new IllegalArgumentException("Stream " + which + " address " + address + " is not IPv4");
            }
            return parsed.getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Stream " + which + " address " + address + " is not valid", e);
        }
    }

    /**
     * Prevent instantiation.
     */
    private SubscribeCommand() {
        // Nothing to do.
    }
}
