package com.servicetemplate.common.broker;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Owns the single broker connection and channel of the process.
 * <p>
 * Every operation runs under one lock for its whole duration, network round-trip included,
 * because a RabbitMQ channel must not be used by several threads at once. Before each
 * operation the session is checked and lazily re-established.
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final BrokerConfig config;
    private final ConnectionFactory factory;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile ConnectionState state = ConnectionState.ABSENT;

    public ConnectionManager(BrokerConfig config) {
        this(config, new ConnectionFactory());
    }

    public ConnectionManager(BrokerConfig config, ConnectionFactory factory) {
        this.config = Objects.requireNonNull(config, "config");
        this.factory = Objects.requireNonNull(factory, "factory");

        factory.setHost(config.getHost());
        factory.setPort(config.getPort());
        factory.setVirtualHost(config.getVirtualHost());
        if (!config.getUsername().isEmpty()) {
            factory.setUsername(config.getUsername());
            factory.setPassword(config.getPassword());
        }
        // reconnects happen on demand in ensureReady, never in the background
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
    }

    /**
     * Makes sure a live connection and channel exist, dialing or reopening as needed.
     * Does nothing when both are already open.
     */
    public void ensureReady() throws ConnectionException {
        lock.lock();
        try {
            openChannel();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ensures the session is ready and runs {@code callback} on the channel, all under the lock.
     */
    public <T> T withChannel(ChannelCallback<T> callback) throws ConnectionException, IOException, InterruptedException {
        lock.lock();
        try {
            Channel ready = openChannel();
            return callback.doInChannel(ready);
        } finally {
            lock.unlock();
        }
    }

    private Channel openChannel() throws ConnectionException {
        String url = config.redactedUrl();

        Connection current = connection;
        if (current == null || !current.isOpen()) {
            logger.warn("[MQEngine] Connection is not initialized or is closed. Connecting to RabbitMQ at {}", url);
            state = ConnectionState.CONNECTING;
            // a channel never outlives its connection
            channel = null;
            try {
                current = factory.newConnection();
                connection = current;
            } catch (IOException | TimeoutException e) {
                connection = null;
                state = ConnectionState.ABSENT;
                logger.error("[MQEngine] Failed to connect to RabbitMQ at {}: {}", url, e.getMessage());
                throw new ConnectionException(ConnectionException.Reason.DIAL_FAILED,
                        "Failed to connect to RabbitMQ at " + url, e);
            }
        }

        Channel currentChannel = channel;
        if (currentChannel == null || !currentChannel.isOpen()) {
            logger.warn("[MQEngine] Channel is not open. Opening channel");
            try {
                currentChannel = current.createChannel();
                if (currentChannel == null) {
                    throw new IOException("Connection has no free channel number");
                }
                if (config.isPublisherConfirms()) {
                    currentChannel.confirmSelect();
                }
                channel = currentChannel;
            } catch (IOException | ShutdownSignalException e) {
                channel = null;
                state = ConnectionState.ABSENT;
                logger.error("[MQEngine] Failed to open channel on {}: {}", url, e.getMessage());
                throw new ConnectionException(ConnectionException.Reason.CHANNEL_FAILED,
                        "Failed to open channel on " + url, e);
            }
        }

        state = ConnectionState.OPEN;
        logger.debug("[MQEngine] Channel is open and ready to use at {}", url);
        return currentChannel;
    }

    /**
     * True when both handles exist, whether or not they are still alive.
     */
    public boolean isConnected() {
        return connection != null && channel != null;
    }

    /**
     * True when both handles exist and the connection reports itself open.
     * Never reconnects.
     */
    public boolean isHealthy() {
        Connection current = connection;
        if (current == null || channel == null) {
            logger.error("[MQEngine] RabbitMQ connection or channel is not initialized");
            return false;
        }
        if (!current.isOpen()) {
            logger.error("[MQEngine] RabbitMQ connection is closed");
            return false;
        }
        return true;
    }

    public ConnectionState getState() {
        Connection current = connection;
        if (state == ConnectionState.OPEN && (current == null || !current.isOpen())) {
            return ConnectionState.ABSENT;
        }
        return state;
    }

    public BrokerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            Channel currentChannel = channel;
            if (currentChannel != null && currentChannel.isOpen()) {
                try {
                    currentChannel.close();
                } catch (IOException | TimeoutException | ShutdownSignalException e) {
                    logger.warn("[MQEngine] Error closing channel: {}", e.getMessage());
                }
            }
            Connection current = connection;
            if (current != null && current.isOpen()) {
                try {
                    current.close();
                } catch (IOException | ShutdownSignalException e) {
                    logger.warn("[MQEngine] Error closing connection: {}", e.getMessage());
                }
            }
            channel = null;
            connection = null;
            state = ConnectionState.ABSENT;
            logger.info("[MQEngine] Disconnected from {}", config.redactedUrl());
        } finally {
            lock.unlock();
        }
    }
}
