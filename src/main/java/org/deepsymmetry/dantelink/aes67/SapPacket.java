package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;
import org.deepsymmetry.dantelink.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Interprets Session Announcement Protocol (RFC 2974) packets, and the Session Description Protocol text they
 * carry, to find out about AES67 streams.</p>
 *
 * <p>Parsing is lenient: anything that is structurally wrong with a packet makes us ignore the whole packet, but
 * unrecognized or malformed individual SDP lines are simply skipped.</p>
 */
@API(status = API.Status.STABLE)
public class SapPacket {

    private static final Logger logger = LoggerFactory.getLogger(SapPacket.class);

    /**
     * The only SAP version we understand.
     */
    public static final int SAP_VERSION = 1;

    /**
     * The shortest packet we will consider: the fixed header plus an IPv4 origin.
     */
    public static final int MINIMUM_LENGTH = 8;

    /**
     * The size of the fixed part of the SAP header, before the originating source address.
     */
    private static final int FIXED_HEADER_LENGTH = 4;

    /**
     * Interpret a received SAP packet.
     *
     * @param data the buffer holding the packet
     * @param length the number of bytes of the packet in the buffer
     *
     * @return the stream announced by the packet, or {@code null} if it was not a well-formed announcement
     *         describing a named session
     */
    @API(status = API.Status.STABLE)
    public static StreamInfo parse(byte[] data, int length) {
        if (length < MINIMUM_LENGTH || length > data.length) {
            logger.debug("Ignoring SAP packet of impossible length {}", length);
            return null;
        }

        final int header = Util.unsign(data[0]);
        final int version = (header >> 5) & 0x07;
        final int addressType = (header >> 4) & 0x01;
        final int messageType = (header >> 2) & 0x01;  // 0 is announcement, 1 is deletion
        if (version != SAP_VERSION || messageType != 0) {
            logger.debug("Ignoring SAP packet with version {} and message type {}", version, messageType);
            return null;
        }

        final int authWords = Util.unsign(data[1]);
        final int originLength = (addressType == 0)? 4 : 16;
        int payloadStart = FIXED_HEADER_LENGTH + originLength + authWords * 4;
        if (payloadStart >= length) {
            logger.debug("Ignoring SAP packet with no room for a payload");
            return null;
        }

        if (!startsWithVersionLine(data, payloadStart, length)) {
            // A payload type (MIME type) precedes the SDP, terminated by a null byte.
            int terminator = -1;
            for (int i = payloadStart; i < length; i++) {
                if (data[i] == 0) {
                    terminator = i;
                    break;
                }
            }
            if (terminator < 0) {
                logger.debug("Ignoring SAP packet with unterminated payload type");
                return null;
            }
            payloadStart = terminator + 1;
        }

        return parseSdp(Util.decodeLossy(data, payloadStart, length - payloadStart));
    }

    /**
     * Check whether the payload begins immediately with the SDP version line.
     */
    private static boolean startsWithVersionLine(byte[] data, int start, int length) {
        return start + 1 < length && data[start] == 'v' && data[start + 1] == '=';
    }

    /**
     * Extract the details of an AES67 stream from an SDP session description.
     *
     * @param sdp the session description text
     *
     * @return the stream described, or {@code null} if the description has no session name
     */
    @API(status = API.Status.STABLE)
    public static StreamInfo parseSdp(String sdp) {
        String sessionName = null;
        Long sessionId = null;
        String originIp = null;
        String multicastAddr = null;
        Integer port = null;
        String codec = null;
        int channels = 1;
        String channelInfo = null;

        for (String rawLine : sdp.strip().split("\\r?\\n|\\r")) {
            final String line = rawLine.strip();
            if (line.startsWith("s=")) {
                sessionName = line.substring(2);
            } else if (line.startsWith("o=")) {
                // o=<user> <session-id> <version> <net> <addrtype> <address>
                final String[] parts = line.substring(2).trim().split("\\s+");
                if (parts.length >= 6) {
                    originIp = parts[5];
                    try {
                        sessionId = Long.parseLong(parts[1]);
                    } catch (NumberFormatException e) {
                        logger.debug("Ignoring malformed session id in SDP origin line: {}", line);
                    }
                }
            } else if (line.startsWith("c=")) {
                // c=IN IP4 239.69.85.220/32
                final String[] parts = line.substring(2).trim().split("\\s+");
                if (parts.length >= 3) {
                    final int slash = parts[2].indexOf('/');
                    multicastAddr = (slash < 0)? parts[2] : parts[2].substring(0, slash);
                }
            } else if (line.startsWith("m=")) {
                // m=audio 5004 RTP/AVP 97
                final String[] parts = line.substring(2).trim().split("\\s+");
                if (parts.length >= 2) {
                    try {
                        port = Integer.parseInt(parts[1]);
                    } catch (NumberFormatException e) {
                        logger.debug("Ignoring malformed port in SDP media line: {}", line);
                    }
                }
            } else if (line.startsWith("a=rtpmap:")) {
                // a=rtpmap:97 L24/48000/2
                final int space = line.indexOf(' ');
                if (space >= 0) {
                    codec = line.substring(space + 1);
                    final String[] codecParts = codec.split("/");
                    if (codecParts.length >= 3) {
                        try {
                            final int parsed = Integer.parseInt(codecParts[2].trim());
                            if (parsed > 0 && parsed <= StreamInfo.MAXIMUM_CHANNEL_COUNT) {
                                channels = parsed;
                            } else {
                                logger.debug("Ignoring out of range channel count in SDP rtpmap line: {}", line);
                            }
                        } catch (NumberFormatException e) {
                            logger.debug("Ignoring malformed channel count in SDP rtpmap line: {}", line);
                        }
                    }
                }
            } else if (line.startsWith("i=")) {
                channelInfo = line.substring(2);
            }
        }

        if (sessionName == null || sessionName.isEmpty()) {
            return null;
        }
        return new StreamInfo(sessionName, sessionId, originIp, multicastAddr, port, codec, channels, channelInfo);
    }

    /**
     * Prevent instantiation.
     */
    private SapPacket() {
        // Nothing to do.
    }
}
