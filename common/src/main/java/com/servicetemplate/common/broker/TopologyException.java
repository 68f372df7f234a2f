package com.servicetemplate.common.broker;

/**
 * Raised when startup provisioning of queues and bindings fails.
 * Usually fatal to the surrounding service.
 */
public class TopologyException extends BrokerException {

    private static final long serialVersionUID = 1L;

    private final String step;

    public TopologyException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    /** The provisioning step that failed, e.g. {@code declare retry queue orders.retry}. */
    public String getStep() {
        return step;
    }
}
