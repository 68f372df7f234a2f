package com.servicetemplate.common.broker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.MessageProperties;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Publishes new messages to the configured exchange, routed by the main queue name.
 * A failed publish is reported, never retried here.
 */
public class MessagePublisher {

    private static final Logger logger = LoggerFactory.getLogger(MessagePublisher.class);

    private final ConnectionManager connectionManager;
    private final RetryPolicy policy;

    public MessagePublisher(ConnectionManager connectionManager, RetryPolicy policy) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param body          message payload, sent as UTF-8
     * @param appId         application id of the sending system
     * @param contentType   MIME type of the payload
     * @param correlationId correlation id to carry
     * @return the published body
     */
    public String publish(String body, String appId, String contentType, String correlationId)
            throws PublishException {
        Objects.requireNonNull(body, "body");

        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(contentType)
                .correlationId(correlationId)
                .appId(appId)
                .deliveryMode(MessageProperties.PERSISTENT_BASIC.getDeliveryMode())
                .headers(new HashMap<>())
                .build();
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);

        boolean confirmed;
        try {
            confirmed = connectionManager.withChannel(channel -> {
                logger.info("[MQEngine] Sending message to queue: {}", policy.getMainQueue());
                channel.basicPublish(policy.getExchange(), policy.getMainQueue(), false, false, properties, payload);
                return awaitConfirm(channel);
            });
        } catch (ConnectionException e) {
            logger.error("[MQEngine] Failed to ensure channel is open: {}", e.getMessage());
            throw new PublishException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Failed to ensure channel is open", e);
        } catch (ShutdownSignalException e) {
            logger.error("[MQEngine] Channel closed while publishing: {}", e.getMessage());
            throw new PublishException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Channel closed while publishing", e);
        } catch (IOException e) {
            logger.error("[MQEngine] Failed to publish message: {}", e.getMessage());
            throw new PublishException(DeliveryFailure.BROKER_REJECTED, "Failed to publish message", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Interrupted while awaiting publish confirm", e);
        }

        if (!confirmed) {
            logger.error("[MQEngine] Broker nacked message for queue {}", policy.getMainQueue());
            throw new PublishException(DeliveryFailure.BROKER_REJECTED,
                    "Broker rejected message for queue " + policy.getMainQueue(), null);
        }
        return body;
    }

    /**
     * Blocks until the broker confirms the last publish. Without confirm mode the publish
     * counts as accepted once written.
     */
    boolean awaitConfirm(Channel channel) throws InterruptedException {
        if (!connectionManager.getConfig().isPublisherConfirms()) {
            return true;
        }
        return channel.waitForConfirms();
    }
}
