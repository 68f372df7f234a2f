package com.servicetemplate.common.broker;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Declares the main, retry and dead-letter queues, then any extra queues from the configuration.
 * Must complete before consumers start.
 * <p>
 * The retry queue dead-letters expired messages back to the main queue through the default
 * exchange, so the broker itself performs delayed redelivery.
 */
public class TopologyInitializer {

    private static final Logger logger = LoggerFactory.getLogger(TopologyInitializer.class);

    public static final String MESSAGE_TTL_ARG = "x-message-ttl";
    public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY_ARG = "x-dead-letter-routing-key";

    private final ConnectionManager connectionManager;

    public TopologyInitializer(ConnectionManager connectionManager) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    }

    public void provisionTopology(RetryPolicy policy) throws TopologyException {
        provisionTopology(policy, connectionManager.getConfig().getQueues());
    }

    /**
     * Runs every declaration in order under the connection lock, stopping at the first failure.
     */
    public void provisionTopology(RetryPolicy policy, List<QueueSpec> extraQueues) throws TopologyException {
        Objects.requireNonNull(policy, "policy");
        BrokerConfig config = connectionManager.getConfig();
        logger.info("[MQEngine] Connecting to RabbitMQ at host {} port {} vhost {}",
                config.getHost(), config.getPort(), config.getVirtualHost());

        String[] step = {"ensure connection"};
        try {
            connectionManager.withChannel(channel -> {
                declareMainQueue(channel, policy, step);
                declareRetryQueue(channel, policy, step);
                declareDeadLetterQueue(channel, policy, step);
                for (QueueSpec spec : extraQueues) {
                    declare(channel, spec, step);
                }
                return null;
            });
        } catch (ConnectionException e) {
            throw new TopologyException(step[0], "Failed to ensure channel is open", e);
        } catch (IOException | ShutdownSignalException e) {
            logger.error("[MQEngine] Failed to {}: {}", step[0], e.getMessage());
            throw new TopologyException(step[0], "Failed to " + step[0], e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TopologyException(step[0], "Interrupted while trying to " + step[0], e);
        }
    }

    private void declareMainQueue(Channel channel, RetryPolicy policy, String[] step) throws IOException {
        String queue = policy.getMainQueue();
        logger.info("[MQEngine] Declaring queue: {}", queue);
        step[0] = "declare queue " + queue;
        channel.queueDeclare(queue, true, false, false, null);

        if (policy.getExchange().isEmpty()) {
            // the default exchange already routes by queue name and refuses explicit bindings
            logger.info("[MQEngine] Queue {} declared on the default exchange", queue);
            return;
        }
        step[0] = "bind queue " + queue + " to exchange " + policy.getExchange();
        channel.queueBind(queue, policy.getExchange(), queue);
        logger.info("[MQEngine] Queue {} declared and bound to {}", queue, policy.getExchange());
    }

    private void declareRetryQueue(Channel channel, RetryPolicy policy, String[] step) throws IOException {
        String queue = policy.getRetryQueue();
        step[0] = "declare retry queue " + queue;
        channel.queueDeclare(queue, true, false, false, retryQueueArguments(policy));
        logger.info("[MQEngine] Retry queue {} declared successfully", queue);
    }

    private void declareDeadLetterQueue(Channel channel, RetryPolicy policy, String[] step) throws IOException {
        String queue = policy.getDeadLetterQueue();
        step[0] = "declare dead letter queue " + queue;
        channel.queueDeclare(queue, true, false, false, null);
        logger.info("[MQEngine] Dead letter queue {} declared successfully", queue);
    }

    private void declare(Channel channel, QueueSpec spec, String[] step) throws IOException {
        String queue = spec.getName();
        Map<String, Object> arguments = spec.getArguments().isEmpty() ? null : new HashMap<>(spec.getArguments());

        step[0] = "declare queue " + queue;
        if (spec.isNoWait()) {
            channel.queueDeclareNoWait(queue, spec.isDurable(), spec.isExclusive(), spec.isAutoDelete(), arguments);
        } else {
            channel.queueDeclare(queue, spec.isDurable(), spec.isExclusive(), spec.isAutoDelete(), arguments);
        }
        if (spec.isBound()) {
            step[0] = "bind queue " + queue + " to exchange " + spec.getExchange();
            channel.queueBind(queue, spec.getExchange(), spec.effectiveRoutingKey());
        }
        logger.info("[MQEngine] Queue {} declared successfully", queue);
    }

    /** Retry queue arguments: fixed TTL, then dead-letter back to the main queue via the default exchange. */
    static Map<String, Object> retryQueueArguments(RetryPolicy policy) {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put(MESSAGE_TTL_ARG, policy.getRetryDelayMillis());
        arguments.put(DEAD_LETTER_EXCHANGE_ARG, "");
        arguments.put(DEAD_LETTER_ROUTING_KEY_ARG, policy.getMainQueue());
        return arguments;
    }
}
