package com.servicetemplate.example;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

@DisplayName("Order handler")
class OrderHandlerTest {

    private final OrderHandler handler = new OrderHandler();

    private static Delivery delivery(String body) {
        return new Delivery(new Envelope(1, false, "", "orders"),
                new AMQP.BasicProperties.Builder().correlationId("c-1").build(),
                body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should accept an order with an id")
    void testValidOrder() {
        assertThatCode(() -> handler.handle(delivery("{\"orderId\": 42, \"items\": 3}"))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should fail on payloads that are not orders")
    void testInvalidOrders() {
        assertThatThrownBy(() -> handler.handle(delivery("not json {"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> handler.handle(delivery("[1, 2]"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> handler.handle(delivery("{\"items\": 3}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("orderId");
    }
}
