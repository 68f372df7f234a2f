package com.servicetemplate.common.broker;

import com.rabbitmq.client.Delivery;

/**
 * Functional interface for processing deliveries taken from a queue.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Process an incoming delivery.
     *
     * @param delivery the delivery to process
     * @throws Exception if processing fails; the delivery is then escalated
     */
    void handle(Delivery delivery) throws Exception;
}
