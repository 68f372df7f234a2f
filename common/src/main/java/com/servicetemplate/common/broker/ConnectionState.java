package com.servicetemplate.common.broker;

/**
 * Lifecycle of the shared broker session. There is no background reconnect:
 * a closed session is only noticed, and repaired, by the next operation.
 */
public enum ConnectionState {
    ABSENT,
    CONNECTING,
    OPEN
}
