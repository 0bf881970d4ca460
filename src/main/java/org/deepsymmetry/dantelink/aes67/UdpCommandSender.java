package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends subscribe commands to the AES67 command port of Dante devices over UDP, using a fresh socket for each
 * exchange so that a late answer to one command can never be mistaken for the answer to another.
 */
@API(status = API.Status.EXPERIMENTAL)
public class UdpCommandSender implements CommandSender {

    private static final Logger logger = LoggerFactory.getLogger(UdpCommandSender.class);

    /**
     * The default number of milliseconds to wait for a device to acknowledge a command.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public static final int DEFAULT_RESPONSE_TIMEOUT = 2000;

    /**
     * The largest acknowledgement we are prepared to receive.
     */
    private static final int BUFFER_SIZE = 512;

    private final AtomicInteger responseTimeout = new AtomicInteger(DEFAULT_RESPONSE_TIMEOUT);

    private final int port;

    /**
     * Create a sender which talks to the standard command port.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public UdpCommandSender() {
        this(SubscribeCommand.COMMAND_PORT);
    }

    /**
     * Create a sender which talks to a different port, mostly useful for testing against a local responder.
     *
     * @param port the UDP port to which commands are sent
     */
    @API(status = API.Status.EXPERIMENTAL)
    public UdpCommandSender(int port) {
        if (port < 1 || port > 0xffff) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.port = port;
    }

    /**
     * Set how long we wait for an acknowledgement before reporting a timeout.
     *
     * @param timeout the response timeout, in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public void setResponseTimeout(int timeout) {
        if (timeout < 1) {
            throw new IllegalArgumentException("Response timeout must be positive");
        }
        responseTimeout.set(timeout);
    }

    /**
     * Check how long we wait for an acknowledgement before reporting a timeout.
     *
     * @return the response timeout, in milliseconds
     */
    @API(status = API.Status.EXPERIMENTAL)
    public int getResponseTimeout() {
        return responseTimeout.get();
    }

    @Override
    public SubscribeResult send(InetAddress device, byte[] frame) {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.setSoTimeout(responseTimeout.get());
            socket.send(new DatagramPacket(frame, frame.length, device, port));
            final byte[] buffer = new byte[BUFFER_SIZE];
            final DatagramPacket response = new DatagramPacket(buffer, buffer.length);
            socket.receive(response);
            final SubscribeResult result = SubscribeCommand.decodeResponse(response.getData(), response.getLength());
            logger.debug("Device {} answered subscribe command: {}", device.getHostAddress(), result);
            return result;
        } catch (SocketTimeoutException e) {
            logger.warn("No response from {} within {} ms", device.getHostAddress(), responseTimeout.get());
            return SubscribeResult.timeout("No response from " + device.getHostAddress());
        } catch (IOException e) {
            logger.warn("Problem sending subscribe command to {}", device.getHostAddress(), e);
            return SubscribeResult.ioError(e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "UdpCommandSender[port:" + port + ", responseTimeout:" + getResponseTimeout() + "]";
    }
}
