package com.servicetemplate.common.broker;

/**
 * Raised when a failed delivery could not be escalated. The message has not been
 * forwarded; the original delivery is still the caller's to reject or leave unacked.
 */
public class ForwardException extends BrokerException {

    private static final long serialVersionUID = 1L;

    private final DeliveryFailure failure;

    public ForwardException(DeliveryFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public DeliveryFailure getFailure() {
        return failure;
    }
}
