package com.servicetemplate.common.broker;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.WeakHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Escalates a delivery whose processing failed: republishes a copy to the retry queue with a
 * backoff, or to the dead-letter queue once the retry budget is spent.
 * <p>
 * The copy goes through the default exchange straight to the chosen queue. The new retry count
 * is written back into the delivery's header table, so escalating the same delivery again counts
 * on from there. Deliveries without a writable header table get their headers tracked here.
 * Settling the delivery only uses its tag and is unaffected.
 */
public class RetryForwarder {

    private static final Logger logger = LoggerFactory.getLogger(RetryForwarder.class);

    private static final String DEFAULT_EXCHANGE = "";

    private final ConnectionManager connectionManager;
    private final MessagePublisher publisher;
    private final RetryPolicy policy;
    private final Map<Delivery, Map<String, Object>> detachedHeaders =
            Collections.synchronizedMap(new WeakHashMap<>());

    public RetryForwarder(ConnectionManager connectionManager, MessagePublisher publisher, RetryPolicy policy) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /** Escalates towards the retry queue of the policy. */
    public Escalation escalate(Delivery delivery) throws ForwardException {
        return escalate(delivery, policy.getRetryQueue());
    }

    /**
     * @param delivery           the failed delivery
     * @param defaultTargetQueue queue to use while the budget lasts; ignored once it is exhausted
     */
    public Escalation escalate(Delivery delivery, String defaultTargetQueue) throws ForwardException {
        Objects.requireNonNull(delivery, "delivery");
        Objects.requireNonNull(defaultTargetQueue, "defaultTargetQueue");

        AMQP.BasicProperties original = delivery.getProperties();
        Map<String, Object> headers = headersOf(delivery);

        RetryMetadata next = RetryMetadata.fromHeaders(headers).nextAttempt();
        Escalation escalation = policy.decide(next, defaultTargetQueue);
        if (escalation.deadLettered()) {
            logger.debug("[MQEngine] Max retry attempts reached. Moving to dead letter queue {}",
                    escalation.targetQueue());
        }

        Map<String, Object> updated = recordAttempt(delivery, headers, next);
        AMQP.BasicProperties properties = copyProperties(original, new HashMap<>(updated), escalation.expiration());
        logger.debug("[MQEngine] Copying message to queue: {} with headers: {} retry count: {} expiration: {}",
                escalation.targetQueue(), properties.getHeaders(), escalation.retryCount(), escalation.expiration());

        boolean confirmed;
        try {
            confirmed = connectionManager.withChannel(channel -> {
                channel.basicPublish(DEFAULT_EXCHANGE, escalation.targetQueue(), false, false,
                        properties, delivery.getBody());
                return publisher.awaitConfirm(channel);
            });
        } catch (ConnectionException e) {
            logger.error("[MQEngine] Failed to ensure channel is open: {}", e.getMessage());
            throw new ForwardException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Failed to ensure channel is open", e);
        } catch (ShutdownSignalException e) {
            logger.error("[MQEngine] Channel closed while copying message: {}", e.getMessage());
            throw new ForwardException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Channel closed while copying message", e);
        } catch (IOException e) {
            logger.error("[MQEngine] Failed to copy message to {}: {}", escalation.targetQueue(), e.getMessage());
            throw new ForwardException(DeliveryFailure.BROKER_REJECTED,
                    "Failed to copy message to " + escalation.targetQueue(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForwardException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Interrupted while awaiting publish confirm", e);
        }

        if (!confirmed) {
            logger.error("[MQEngine] Broker nacked copy for queue {}", escalation.targetQueue());
            throw new ForwardException(DeliveryFailure.BROKER_REJECTED,
                    "Broker rejected copy for queue " + escalation.targetQueue(), null);
        }
        return escalation;
    }

    private Map<String, Object> headersOf(Delivery delivery) {
        Map<String, Object> detached = detachedHeaders.get(delivery);
        if (detached != null) {
            return detached;
        }
        AMQP.BasicProperties properties = delivery.getProperties();
        return properties == null ? null : properties.getHeaders();
    }

    private Map<String, Object> recordAttempt(Delivery delivery, Map<String, Object> headers, RetryMetadata next) {
        if (headers != null) {
            try {
                return next.writeTo(headers);
            } catch (UnsupportedOperationException e) {
                logger.debug("[MQEngine] Header table of delivery {} is read-only, tracking it separately",
                        delivery.getEnvelope() == null ? "?" : delivery.getEnvelope().getDeliveryTag());
            }
        }
        Map<String, Object> tracked = next.writeTo(headers == null ? null : new HashMap<>(headers));
        detachedHeaders.put(delivery, tracked);
        return tracked;
    }

    private static AMQP.BasicProperties copyProperties(AMQP.BasicProperties original, Map<String, Object> headers,
                                                       String expiration) {
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder()
                .headers(headers)
                .expiration(expiration);
        if (original != null) {
            builder.contentType(original.getContentType())
                    .correlationId(original.getCorrelationId())
                    .appId(original.getAppId())
                    .replyTo(original.getReplyTo())
                    .messageId(original.getMessageId())
                    .timestamp(original.getTimestamp())
                    .deliveryMode(original.getDeliveryMode());
        }
        return builder.build();
    }
}
