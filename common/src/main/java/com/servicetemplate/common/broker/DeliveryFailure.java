package com.servicetemplate.common.broker;

/**
 * Why a publish or forward did not reach the broker.
 */
public enum DeliveryFailure {
    /** No usable channel: reconnect failed or the channel closed mid-call. */
    CHANNEL_UNAVAILABLE,
    /** The broker refused the message (I/O error on publish or a negative confirm). */
    BROKER_REJECTED
}
