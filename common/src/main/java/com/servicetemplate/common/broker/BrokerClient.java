package com.servicetemplate.common.broker;

import java.util.Objects;

import com.rabbitmq.client.Delivery;

/**
 * Client for the RabbitMQ retry topology: one shared connection, a main queue, a retry queue
 * and a dead-letter queue.
 * <p>
 * Create one per process and pass it to whatever needs the broker.
 */
public class BrokerClient implements AutoCloseable {

    private final ConnectionManager connectionManager;
    private final RetryPolicy policy;
    private final TopologyInitializer topology;
    private final MessagePublisher publisher;
    private final DeliveryConsumer consumer;
    private final RetryForwarder forwarder;

    public BrokerClient(BrokerConfig config, RetryPolicy policy) {
        this(new ConnectionManager(config), policy);
    }

    public BrokerClient(ConnectionManager connectionManager, RetryPolicy policy) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.topology = new TopologyInitializer(connectionManager);
        this.publisher = new MessagePublisher(connectionManager, policy);
        this.consumer = new DeliveryConsumer(connectionManager);
        this.forwarder = new RetryForwarder(connectionManager, publisher, policy);
    }

    /**
     * Establishes the connection and channel if they are not already open.
     */
    public void connect() throws ConnectionException {
        connectionManager.ensureReady();
    }

    /**
     * Declares the retry topology and the configured extra queues. Call once at startup,
     * before any consumer starts.
     */
    public void provisionTopology() throws TopologyException {
        topology.provisionTopology(policy);
    }

    /**
     * Publishes a new message to the main queue.
     *
     * @return the published body
     */
    public String publish(String body, String appId, String contentType, String correlationId)
            throws PublishException {
        return publisher.publish(body, appId, contentType, correlationId);
    }

    /**
     * Registers a consumer on {@code queueName}. With {@code autoAck} off, settle each delivery
     * through the returned stream.
     */
    public DeliveryStream consume(String queueName, boolean autoAck) throws ConsumeException {
        return consumer.consume(queueName, autoAck);
    }

    public void ack(DeliveryStream stream, Delivery delivery) throws ConsumeException {
        stream.ack(delivery);
    }

    public void reject(DeliveryStream stream, Delivery delivery, boolean requeue) throws ConsumeException {
        stream.reject(delivery, requeue);
    }

    /** Escalates a failed delivery towards the retry queue. */
    public Escalation escalate(Delivery delivery) throws ForwardException {
        return forwarder.escalate(delivery);
    }

    /** Escalates a failed delivery towards {@code targetQueue} while retry budget remains. */
    public Escalation escalate(Delivery delivery, String targetQueue) throws ForwardException {
        return forwarder.escalate(delivery, targetQueue);
    }

    public boolean isConnected() {
        return connectionManager.isConnected();
    }

    public boolean isHealthy() {
        return connectionManager.isHealthy();
    }

    public ConnectionState getState() {
        return connectionManager.getState();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    @Override
    public void close() {
        connectionManager.close();
    }
}
