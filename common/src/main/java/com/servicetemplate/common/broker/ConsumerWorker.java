package com.servicetemplate.common.broker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Delivery;

/**
 * Consumes a queue with manual acknowledgement and dispatches each delivery to a handler.
 * <p>
 * A delivery is acked after the handler succeeds. When the handler throws, the delivery is
 * escalated and then acked; if escalation fails it is rejected with requeue so it is not lost.
 */
public class ConsumerWorker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerWorker.class);

    private final BrokerClient brokerClient;
    private final String queueName;
    private final MessageHandler handler;
    private final MessageArchiver archiver;

    private final AtomicLong messagesProcessed = new AtomicLong();
    private final AtomicLong messagesEscalated = new AtomicLong();
    private final AtomicLong messagesDeadLettered = new AtomicLong();
    private final AtomicLong messagesRequeued = new AtomicLong();

    private volatile boolean running;
    private volatile DeliveryStream stream;
    private Thread thread;

    public ConsumerWorker(BrokerClient brokerClient, String queueName, MessageHandler handler) {
        this(brokerClient, queueName, handler, null);
    }

    /**
     * @param archiver when not null, dead-lettered messages are also written to disk
     */
    public ConsumerWorker(BrokerClient brokerClient, String queueName, MessageHandler handler,
                          MessageArchiver archiver) {
        this.brokerClient = Objects.requireNonNull(brokerClient, "brokerClient");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.archiver = archiver;
    }

    public synchronized void start() throws ConsumeException {
        if (running) return;

        stream = brokerClient.consume(queueName, false);
        running = true;
        thread = new Thread(this::run, "consumer-" + queueName);
        thread.setDaemon(true);
        thread.start();
        logger.info("ConsumerWorker started on queue {}", queueName);
    }

    private void run() {
        DeliveryStream current = stream;
        for (Delivery delivery : current) {
            if (!running) break;
            process(current, delivery);
        }
        running = false;
        logger.info("ConsumerWorker on queue {} stopped", queueName);
    }

    void process(DeliveryStream current, Delivery delivery) {
        if (handle(delivery)) {
            try {
                current.ack(delivery);
                messagesProcessed.incrementAndGet();
            } catch (ConsumeException e) {
                logger.warn("Could not ack delivery on {}: {}", queueName, e.getMessage());
            }
            return;
        }

        try {
            Escalation escalation = brokerClient.escalate(delivery);
            current.ack(delivery);
            messagesEscalated.incrementAndGet();
            if (escalation.deadLettered()) {
                messagesDeadLettered.incrementAndGet();
                archive(delivery);
            }
        } catch (ForwardException e) {
            logger.error("Escalation failed on {}, requeueing delivery: {}", queueName, e.getMessage());
            requeue(current, delivery);
        } catch (ConsumeException e) {
            // the copy is already forwarded; the broker will redeliver the original as well
            logger.warn("Could not ack escalated delivery on {}: {}", queueName, e.getMessage());
        }
    }

    private boolean handle(Delivery delivery) {
        try {
            handler.handle(delivery);
            return true;
        } catch (Exception e) {
            String correlationId = delivery.getProperties() == null ? null : delivery.getProperties().getCorrelationId();
            logger.warn("Handler failed for message {} on {}: {}", correlationId, queueName, e.getMessage());
            return false;
        }
    }

    private void requeue(DeliveryStream current, Delivery delivery) {
        try {
            current.reject(delivery, true);
            messagesRequeued.incrementAndGet();
        } catch (ConsumeException e) {
            logger.warn("Could not requeue delivery on {}; left unacked: {}", queueName, e.getMessage());
        }
    }

    private void archive(Delivery delivery) {
        if (archiver == null || delivery.getProperties() == null) return;

        String correlationId = delivery.getProperties().getCorrelationId();
        if (correlationId == null || correlationId.isBlank()) {
            logger.warn("Dead-lettered message on {} has no correlation id; not archived", queueName);
            return;
        }
        try {
            archiver.save(correlationId, new String(delivery.getBody(), StandardCharsets.UTF_8),
                    delivery.getProperties().getHeaders());
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Failed to archive dead-lettered message {}: {}", correlationId, e.getMessage());
        }
    }

    public boolean isRunning() {
        return running;
    }

    public String getQueueName() {
        return queueName;
    }

    public long getMessagesProcessed() {
        return messagesProcessed.get();
    }

    public long getMessagesEscalated() {
        return messagesEscalated.get();
    }

    public long getMessagesDeadLettered() {
        return messagesDeadLettered.get();
    }

    public long getMessagesRequeued() {
        return messagesRequeued.get();
    }

    @Override
    public synchronized void close() {
        running = false;
        DeliveryStream current = stream;
        if (current != null) {
            current.close();
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
