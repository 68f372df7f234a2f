package com.servicetemplate.common.broker;

/**
 * Raised when a new message could not be published into the topology.
 * The publish is never retried internally.
 */
public class PublishException extends BrokerException {

    private static final long serialVersionUID = 1L;

    private final DeliveryFailure failure;

    public PublishException(DeliveryFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public DeliveryFailure getFailure() {
        return failure;
    }
}
