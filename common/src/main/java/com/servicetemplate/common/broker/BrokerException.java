package com.servicetemplate.common.broker;

/**
 * Base type for every failure raised by the message-queue engine.
 * Callers may retry after {@link ConnectionManager#ensureReady()} succeeds again.
 */
public abstract class BrokerException extends Exception {

    private static final long serialVersionUID = 1L;

    protected BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
