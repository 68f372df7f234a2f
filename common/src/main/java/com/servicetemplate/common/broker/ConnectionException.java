package com.servicetemplate.common.broker;

/**
 * Raised when the shared connection or channel cannot be (re)established.
 */
public class ConnectionException extends BrokerException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** The broker could not be dialed. */
        DIAL_FAILED,
        /** The connection is up but no channel could be opened on it. */
        CHANNEL_FAILED
    }

    private final Reason reason;

    public ConnectionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
