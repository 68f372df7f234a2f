package com.servicetemplate.common.broker;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Unbounded, lazily filled sequence of deliveries for one registered consumer.
 * <p>
 * Reading happens outside the connection lock. The stream ends when the broker cancels the
 * consumer, the channel shuts down, or {@link #close()} is called; it never ends on its own.
 */
public class DeliveryStream implements Iterable<Delivery>, AutoCloseable {

    private static final Delivery END_OF_STREAM = new Delivery(null, null, new byte[0]);

    private final String queueName;
    private final Channel channel;
    private final DeliveryConsumer owner;
    private final BlockingQueue<Delivery> buffer = new LinkedBlockingQueue<>();
    private final StreamConsumer consumer;

    private volatile String consumerTag;
    private volatile boolean finished;

    DeliveryStream(String queueName, Channel channel, DeliveryConsumer owner) {
        this.queueName = queueName;
        this.channel = channel;
        this.owner = owner;
        this.consumer = new StreamConsumer(channel);
    }

    DefaultConsumer consumer() {
        return consumer;
    }

    Channel channel() {
        return channel;
    }

    public String getQueueName() {
        return queueName;
    }

    /** Tag assigned by the broker once registration completed. */
    public String getConsumerTag() {
        return consumerTag != null ? consumerTag : consumer.getConsumerTag();
    }

    void registered(String tag) {
        this.consumerTag = tag;
    }

    /** True once no further deliveries can arrive; buffered ones may still be read. */
    public boolean isFinished() {
        return finished;
    }

    /**
     * Waits for the next delivery.
     *
     * @return the delivery, or {@code null} once the stream has ended
     */
    public Delivery take() throws InterruptedException {
        Delivery next = buffer.take();
        return unwrap(next);
    }

    /**
     * Waits up to {@code timeout} for the next delivery.
     *
     * @return the delivery, or {@code null} on timeout or once the stream has ended
     */
    public Delivery poll(Duration timeout) throws InterruptedException {
        Delivery next = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return next == null ? null : unwrap(next);
    }

    private Delivery unwrap(Delivery next) {
        if (next == END_OF_STREAM) {
            // keep the marker for other readers
            buffer.offer(END_OF_STREAM);
            return null;
        }
        return next;
    }

    /**
     * Blocking iterator. Iteration stops when the stream ends or the reading thread is interrupted
     * (the interrupt flag is restored).
     */
    @Override
    public Iterator<Delivery> iterator() {
        return new Iterator<>() {
            private Delivery next;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                try {
                    next = take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
                return next != null;
            }

            @Override
            public Delivery next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Delivery stream for " + queueName + " has ended");
                }
                Delivery current = next;
                next = null;
                return current;
            }
        };
    }

    void finish() {
        if (!finished) {
            finished = true;
            buffer.offer(END_OF_STREAM);
        }
    }

    /** Acknowledges a delivery read from this stream. */
    public void ack(Delivery delivery) throws ConsumeException {
        owner.settle(this, delivery, true, false);
    }

    /** Negatively acknowledges a delivery read from this stream. */
    public void reject(Delivery delivery, boolean requeue) throws ConsumeException {
        owner.settle(this, delivery, false, requeue);
    }

    /** Cancels the consumer on the broker and ends the stream. */
    @Override
    public void close() {
        if (finished) {
            return;
        }
        owner.cancel(this);
        finish();
    }

    private final class StreamConsumer extends DefaultConsumer {

        private StreamConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
                                   byte[] body) {
            buffer.offer(new Delivery(envelope, properties, body));
        }

        @Override
        public void handleCancelOk(String consumerTag) {
            finish();
        }

        @Override
        public void handleCancel(String consumerTag) {
            finish();
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            finish();
        }
    }
}
