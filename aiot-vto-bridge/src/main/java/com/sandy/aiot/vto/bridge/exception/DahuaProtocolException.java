package com.sandy.aiot.vto.bridge.exception;

import lombok.Getter;

/**
 * Raised when a door station answers an RPC step with a non-success status or a malformed body.
 */
@Getter
public class DahuaProtocolException extends RuntimeException {

    private final String step;

    public DahuaProtocolException(String step, String message) {
        super(message);
        this.step = step;
    }

    public DahuaProtocolException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public static DahuaProtocolException badStatus(String step, int status) {
        return new DahuaProtocolException(step, String.format("%s failed, HTTP status %d", step, status));
    }

    public static DahuaProtocolException malformed(String step, String detail) {
        return new DahuaProtocolException(step, String.format("%s returned a malformed response: %s", step, detail));
    }

    public static DahuaProtocolException network(String step, Throwable cause) {
        return new DahuaProtocolException(step, String.format("%s network request failed: %s", step, cause.getMessage()), cause);
    }
}
