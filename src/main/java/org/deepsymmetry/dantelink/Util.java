package org.deepsymmetry.dantelink;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;

/**
 * Provides utility functions.
 */
@SuppressWarnings("WeakerAccess")
@API(status = API.Status.STABLE)
public class Util {

    private static final Logger logger = LoggerFactory.getLogger(Util.class);

    /**
     * The mDNS service type advertised by Dante devices for audio routing control.
     */
    @API(status = API.Status.STABLE)
    public static final String SERVICE_ARC = "_netaudio-arc._udp.local.";

    /**
     * The mDNS service type advertised once for each transmit channel a Dante device offers.
     */
    @API(status = API.Status.STABLE)
    public static final String SERVICE_CHAN = "_netaudio-chan._udp.local.";

    /**
     * The mDNS service type of the control and monitoring channel. Only records of this type carry a trustworthy
     * {@code id} property holding the device's MAC address.
     */
    @API(status = API.Status.STABLE)
    public static final String SERVICE_CMC = "_netaudio-cmc._udp.local.";

    /**
     * The mDNS service type used for device broadcast control.
     */
    @API(status = API.Status.STABLE)
    public static final String SERVICE_DBC = "_netaudio-dbc._udp.local.";

    /**
     * All the service types we browse for when looking for Dante devices.
     */
    @API(status = API.Status.STABLE)
    public static final List<String> SERVICES = List.of(SERVICE_ARC, SERVICE_CHAN, SERVICE_CMC, SERVICE_DBC);

    /**
     * The suffix that mDNS host names carry, which we do not want to show up in device keys.
     */
    private static final String LOCAL_SUFFIX = ".local";

    /**
     * Turn a host name reported by mDNS into the key we use to identify the device, by removing a trailing
     * dot and then a trailing {@code .local} suffix.
     *
     * @param serverName the raw host name, as found in the service record
     *
     * @return the normalized name, or {@code null} if {@code serverName} was {@code null}
     */
    @API(status = API.Status.STABLE)
    public static String normalizeServerName(String serverName) {
        if (serverName == null) {
            return null;
        }
        String result = serverName;
        if (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        if (result.endsWith(LOCAL_SUFFIX)) {
            result = result.substring(0, result.length() - LOCAL_SUFFIX.length());
        }
        return result;
    }

    /**
     * Derive a host name from a service instance name, for records which were resolved without one. Everything
     * after the first label is discarded.
     *
     * @param instanceName the full service instance name
     *
     * @return the first dot-separated label of the instance name
     */
    @API(status = API.Status.STABLE)
    public static String serverNameFromInstance(String instanceName) {
        final int dot = instanceName.indexOf('.');
        return (dot < 0)? instanceName : instanceName.substring(0, dot);
    }

    /**
     * Decode bytes as UTF-8 text, substituting the replacement character for anything malformed rather than
     * failing.
     *
     * @param bytes the buffer holding the text
     * @param offset where the text starts
     * @param length how many bytes of text there are
     *
     * @return the decoded text
     */
    @API(status = API.Status.STABLE)
    public static String decodeLossy(byte[] bytes, int offset, int length) {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, offset, length)).toString();
        } catch (CharacterCodingException e) {
            // Cannot happen with REPLACE actions, but fall back to the lenient String constructor anyway.
            return new String(bytes, offset, length, StandardCharsets.UTF_8);
        }
    }

    /**
     * Converts a signed byte to its unsigned int equivalent in the range 0-255.
     *
     * @param b a byte value to be considered an unsigned integer
     *
     * @return the unsigned version of the byte
     */
    @API(status = API.Status.STABLE)
    public static int unsign(byte b) {
        return b & 0xff;
    }

    /**
     * Reconstructs a number that is represented by more than one byte in a network packet in big-endian order.
     *
     * @param buffer the byte array containing the packet data
     * @param start the index of the first byte containing a numeric value
     * @param length the number of bytes making up the value
     * @return the reconstructed number
     */
    @API(status = API.Status.STABLE)
    public static long bytesToNumber(byte[] buffer, int start, int length) {
        long result = 0;
        for (int index = start; index < start + length; index++) {
            result = (result << 8) + unsign(buffer[index]);
        }
        return result;
    }

    /**
     * Writes a number to the specified byte array field, breaking it into its component bytes in big-endian order.
     * If the number is too large to fit in the specified number of bytes, only the low-order bytes are written.
     *
     * @param number the number to be written to the array
     * @param buffer the buffer to which the number should be written
     * @param start where the high-order byte should be written
     * @param length how many bytes of the number should be written
     */
    @API(status = API.Status.STABLE)
    public static void numberToBytes(long number, byte[] buffer, int start, int length) {
        for (int index = start + length - 1; index >= start; index--) {
            buffer[index] = (byte)(number & 0xff);
            number = number >> 8;
        }
    }

    /**
     * Find the local address we should use to reach the devices we have found, by opening a UDP socket
     * "connected" to each device address in turn and seeing which local address the operating system picked
     * for it. No packets are sent. The first device that can be routed to wins.
     *
     * @param deviceAddresses the IPv4 addresses of devices found on the network, in dotted-quad form
     *
     * @return the local address on the interface which can reach a device, or {@code null} if none could
     */
    @API(status = API.Status.STABLE)
    public static InetAddress findBindAddress(Collection<String> deviceAddresses) {
        for (String candidate : deviceAddresses) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            try (DatagramSocket routeFinder = new DatagramSocket()) {
                routeFinder.connect(new InetSocketAddress(InetAddress.getByName(candidate), 1));
                final InetAddress local = routeFinder.getLocalAddress();
                if (local != null && !local.isAnyLocalAddress()) {
                    return local;
                }
            } catch (Exception e) {
                logger.debug("Unable to find a route to device address {}", candidate, e);
            }
        }
        return null;
    }

    /**
     * Prevent instantiation.
     */
    private Util() {
        // Nothing to do.
    }
}
