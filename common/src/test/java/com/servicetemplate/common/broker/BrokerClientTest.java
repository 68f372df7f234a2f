package com.servicetemplate.common.broker;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Broker client")
class BrokerClientTest {

    private MockBroker broker;
    private BrokerClient client;

    @BeforeEach
    void setUp() throws Exception {
        broker = new MockBroker();
        client = new BrokerClient(broker.manager(), MockBroker.ordersPolicy());
    }

    @Test
    @DisplayName("Should provision, publish and escalate over one shared channel")
    void testRoundTrip() throws Exception {
        client.provisionTopology();
        client.publish("{\"orderId\":1}", "orders-api", "application/json", "c-1");
        Escalation escalation = client.escalate(MockBroker.delivery(1, Map.of(), "{\"orderId\":1}"));

        assertThat(escalation.targetQueue()).isEqualTo("orders.retry");
        verify(broker.factory, times(1)).newConnection();
        verify(broker.connection, times(1)).createChannel();
        verify(broker.channel).basicPublish(eq(""), eq("orders.retry"), eq(false), eq(false), any(), any());
        assertThat(client.isConnected()).isTrue();
        assertThat(client.isHealthy()).isTrue();
        assertThat(client.getState()).isEqualTo(ConnectionState.OPEN);
    }

    @Test
    @DisplayName("Close tears the session down")
    void testClose() throws Exception {
        client.connect();

        client.close();

        assertThat(client.isConnected()).isFalse();
        assertThat(client.getState()).isEqualTo(ConnectionState.ABSENT);
    }
}
