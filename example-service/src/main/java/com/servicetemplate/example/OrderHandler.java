package com.servicetemplate.example;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.rabbitmq.client.Delivery;
import com.servicetemplate.common.broker.MessageHandler;

/**
 * Accepts order messages carrying a JSON object with an {@code orderId}.
 * Anything else fails and goes through the retry path.
 */
public class OrderHandler implements MessageHandler {

    private static final Logger logger = LoggerFactory.getLogger(OrderHandler.class);

    @Override
    public void handle(Delivery delivery) {
        String body = new String(delivery.getBody(), StandardCharsets.UTF_8);
        JsonObject order;
        try {
            order = JsonParser.parseString(body).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IllegalArgumentException("Order is not a JSON object: " + e.getMessage(), e);
        }
        if (!order.has("orderId") || order.get("orderId").isJsonNull()) {
            throw new IllegalArgumentException("Order has no orderId");
        }
        logger.info("Processed order {} (correlationId={})",
                order.get("orderId").getAsString(), delivery.getProperties().getCorrelationId());
    }
}
