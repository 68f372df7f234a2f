package com.servicetemplate.common.broker;

/**
 * Raised when a consumer could not be registered on a queue.
 */
public class ConsumeException extends BrokerException {

    private static final long serialVersionUID = 1L;

    private final DeliveryFailure failure;

    public ConsumeException(DeliveryFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public DeliveryFailure getFailure() {
        return failure;
    }
}
