package com.servicetemplate.common.broker;

import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Registers consumers on the shared channel and hands back their delivery streams.
 * With {@code autoAck} off the caller acknowledges or rejects every delivery itself.
 */
public class DeliveryConsumer {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryConsumer.class);

    // empty tag asks the broker to generate a unique one
    private static final String BROKER_GENERATED_TAG = "";

    private final ConnectionManager connectionManager;

    public DeliveryConsumer(ConnectionManager connectionManager) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    }

    public DeliveryStream consume(String queueName, boolean autoAck) throws ConsumeException {
        Objects.requireNonNull(queueName, "queueName");
        try {
            return connectionManager.withChannel(channel -> {
                logger.info("[MQEngine] Starting to consume from queue: {}", queueName);
                DeliveryStream stream = new DeliveryStream(queueName, channel, this);
                String tag = channel.basicConsume(queueName, autoAck, BROKER_GENERATED_TAG,
                        false, false, null, stream.consumer());
                stream.registered(tag);
                logger.info("[MQEngine] Consumer {} registered successfully on {}", tag, queueName);
                return stream;
            });
        } catch (ConnectionException e) {
            logger.error("[MQEngine] Failed to ensure channel is open: {}", e.getMessage());
            throw new ConsumeException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Failed to ensure channel is open", e);
        } catch (ShutdownSignalException e) {
            logger.error("[MQEngine] Channel closed while registering consumer: {}", e.getMessage());
            throw new ConsumeException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Channel closed while registering consumer", e);
        } catch (IOException e) {
            logger.error("[MQEngine] Failed to register consumer on {}: {}", queueName, e.getMessage());
            throw new ConsumeException(DeliveryFailure.BROKER_REJECTED, "Failed to register consumer on " + queueName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConsumeException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Interrupted while registering consumer", e);
        }
    }

    /**
     * Acks or nacks on the channel the delivery arrived on. Delivery tags are only valid there, so a
     * delivery whose channel has closed cannot be settled; the broker redelivers it instead.
     */
    void settle(DeliveryStream stream, Delivery delivery, boolean ack, boolean requeue) throws ConsumeException {
        Channel owner = stream.channel();
        long tag = delivery.getEnvelope().getDeliveryTag();
        if (!owner.isOpen()) {
            throw new ConsumeException(DeliveryFailure.CHANNEL_UNAVAILABLE,
                    "Channel of delivery " + tag + " is closed; the broker will redeliver it", null);
        }
        try {
            connectionManager.withChannel(channel -> {
                if (channel != owner) {
                    throw new IOException("Channel of delivery " + tag + " was replaced");
                }
                if (ack) {
                    channel.basicAck(tag, false);
                } else {
                    channel.basicNack(tag, false, requeue);
                }
                return null;
            });
        } catch (ConnectionException | ShutdownSignalException e) {
            throw new ConsumeException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Failed to settle delivery " + tag, e);
        } catch (IOException e) {
            logger.error("[MQEngine] Failed to settle delivery {}: {}", tag, e.getMessage());
            throw new ConsumeException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Failed to settle delivery " + tag, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConsumeException(DeliveryFailure.CHANNEL_UNAVAILABLE, "Interrupted while settling delivery " + tag, e);
        }
    }

    void cancel(DeliveryStream stream) {
        Channel owner = stream.channel();
        String tag = stream.getConsumerTag();
        if (tag == null || !owner.isOpen()) {
            // a closed channel already dropped its consumers
            return;
        }
        try {
            connectionManager.withChannel(channel -> {
                if (channel == owner) {
                    channel.basicCancel(tag);
                }
                return null;
            });
            logger.info("[MQEngine] Consumer {} on {} cancelled", tag, stream.getQueueName());
        } catch (ConnectionException | IOException | ShutdownSignalException e) {
            logger.warn("[MQEngine] Could not cancel consumer {}: {}", tag, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[MQEngine] Interrupted while cancelling consumer {}", tag);
        }
    }
}
