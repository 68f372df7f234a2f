package com.servicetemplate.common.broker;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

@DisplayName("Topology initializer")
class TopologyInitializerTest {

    private MockBroker broker;

    @BeforeEach
    void setUp() throws Exception {
        broker = new MockBroker();
    }

    @Test
    @DisplayName("Should declare main, retry and dead-letter queues in order")
    void testRetryTopology() throws Exception {
        RetryPolicy policy = RetryPolicy.builder("orders").retryDelayMillis(5000).build();

        new TopologyInitializer(broker.manager()).provisionTopology(policy);

        InOrder order = inOrder(broker.channel);
        order.verify(broker.channel).queueDeclare("orders", true, false, false, null);
        order.verify(broker.channel).queueDeclare("orders.retry", true, false, false, Map.of(
                "x-message-ttl", 5000,
                "x-dead-letter-exchange", "",
                "x-dead-letter-routing-key", "orders"));
        order.verify(broker.channel).queueDeclare("orders.dlq", true, false, false, null);
        verify(broker.channel, never()).queueBind(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("Retry queue TTL is sent as a 32-bit integer")
    void testTtlArgumentType() {
        Map<String, Object> arguments = TopologyInitializer.retryQueueArguments(MockBroker.ordersPolicy());

        assertThat(arguments.get(TopologyInitializer.MESSAGE_TTL_ARG)).isInstanceOf(Integer.class).isEqualTo(5000);
    }

    @Test
    @DisplayName("Should bind the main queue when an exchange is named")
    void testExchangeBinding() throws Exception {
        RetryPolicy policy = RetryPolicy.builder("orders").exchange("shop").build();

        new TopologyInitializer(broker.manager()).provisionTopology(policy);

        verify(broker.channel).queueBind("orders", "shop", "orders");
    }

    @Test
    @DisplayName("Should declare configured extra queues after the retry topology")
    void testExtraQueues() throws Exception {
        QueueSpec audit = QueueSpec.builder("audit").autoDelete(true).build();
        QueueSpec events = QueueSpec.builder("events").exchange("bus").routingKey("events.#")
                .argument("x-max-length", 100).build();
        QueueSpec fast = QueueSpec.builder("fast").durable(false).noWait(true).build();
        ConnectionManager manager = broker.manager(MockBroker.config().queues(audit, events, fast).build());

        new TopologyInitializer(manager).provisionTopology(MockBroker.ordersPolicy());

        InOrder order = inOrder(broker.channel);
        order.verify(broker.channel).queueDeclare(eq("orders.dlq"), anyBoolean(), anyBoolean(), anyBoolean(), any());
        order.verify(broker.channel).queueDeclare("audit", true, false, true, null);
        order.verify(broker.channel).queueDeclare("events", true, false, false, Map.of("x-max-length", 100));
        order.verify(broker.channel).queueBind("events", "bus", "events.#");
        order.verify(broker.channel).queueDeclareNoWait("fast", false, false, false, null);
    }

    @Test
    @DisplayName("Should stop at the first failing declaration and name the step")
    void testStepFailure() throws Exception {
        when(broker.channel.queueDeclare(eq("orders.retry"), anyBoolean(), anyBoolean(), anyBoolean(), any()))
                .thenThrow(new IOException("PRECONDITION_FAILED - inequivalent arg 'x-message-ttl'"));

        TopologyInitializer initializer = new TopologyInitializer(broker.manager());

        assertThatThrownBy(() -> initializer.provisionTopology(MockBroker.ordersPolicy(), List.of()))
                .isInstanceOf(TopologyException.class)
                .satisfies(e -> assertThat(((TopologyException) e).getStep()).isEqualTo("declare retry queue orders.retry"))
                .hasCauseInstanceOf(IOException.class);
        verify(broker.channel, never()).queueDeclare(eq("orders.dlq"), anyBoolean(), anyBoolean(), anyBoolean(), any());
    }

    @Test
    @DisplayName("Connection failure is reported as a topology failure")
    void testConnectionFailure() throws Exception {
        when(broker.factory.newConnection()).thenThrow(new IOException("refused"));

        assertThatThrownBy(() -> new TopologyInitializer(broker.manager()).provisionTopology(MockBroker.ordersPolicy()))
                .isInstanceOf(TopologyException.class)
                .hasCauseInstanceOf(ConnectionException.class);
    }
}
