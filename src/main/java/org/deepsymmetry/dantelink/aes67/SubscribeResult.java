package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;

/**
 * The outcome of sending an AES67 subscribe command to a Dante device. Timeouts are reported separately from
 * responses the device actually sent, so callers can decide whether a retry makes sense.
 */
@API(status = API.Status.EXPERIMENTAL)
public class SubscribeResult {

    /**
     * The kinds of outcome a subscribe command can have.
     */
    @API(status = API.Status.EXPERIMENTAL)
    public enum Kind {

        /**
         * The device acknowledged the subscription with status 1.
         */
        SUCCESS,

        /**
         * The device sent a well-formed acknowledgement with a status other than 1.
         */
        REJECTED,

        /**
         * The device sent something that was not a recognizable acknowledgement.
         */
        MALFORMED_RESPONSE,

        /**
         * Nothing came back before the response deadline.
         */
        TIMEOUT,

        /**
         * The command could not be sent, or the receive failed for a reason other than the deadline.
         */
        IO_ERROR
    }

    private static final SubscribeResult SUCCESS = new SubscribeResult(Kind.SUCCESS, 1, null);

    /**
     * What happened.
     */
    public final Kind kind;

    /**
     * The status value the device reported, or {@code null} if no acknowledgement was interpreted.
     */
    public final Integer status;

    /**
     * A description of what went wrong, for failures that have one.
     */
    public final String message;

    private SubscribeResult(Kind kind, Integer status, String message) {
        this.kind = kind;
        this.status = status;
        this.message = message;
    }

    @API(status = API.Status.EXPERIMENTAL)
    public static SubscribeResult success() {
        return SUCCESS;
    }

    @API(status = API.Status.EXPERIMENTAL)
    public static SubscribeResult rejected(int status) {
        return new SubscribeResult(Kind.REJECTED, status, "Device returned status " + status);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public static SubscribeResult malformed(String message) {
        return new SubscribeResult(Kind.MALFORMED_RESPONSE, null, message);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public static SubscribeResult timeout(String message) {
        return new SubscribeResult(Kind.TIMEOUT, null, message);
    }

    @API(status = API.Status.EXPERIMENTAL)
    public static SubscribeResult ioError(String message) {
        return new SubscribeResult(Kind.IO_ERROR, null, message);
    }

    /**
     * Check whether the subscription was accepted.
     *
     * @return {@code true} only for {@link Kind#SUCCESS}
     */
    @API(status = API.Status.EXPERIMENTAL)
    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("SubscribeResult[").append(kind);
        if (status != null) {
            sb.append(", status:").append(status);
        }
        if (message != null && kind != Kind.SUCCESS) {
            sb.append(", message:").append(message);
        }
        return sb.append("]").toString();
    }
}
