package com.servicetemplate.common.broker;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

@DisplayName("Retry forwarder")
class RetryForwarderTest {

    private MockBroker broker;
    private RetryForwarder forwarder;

    @BeforeEach
    void setUp() throws Exception {
        broker = new MockBroker();
        ConnectionManager manager = broker.manager();
        RetryPolicy policy = MockBroker.ordersPolicy();
        forwarder = new RetryForwarder(manager, new MessagePublisher(manager, policy), policy);
    }

    private AMQP.BasicProperties publishedTo(String queue, byte[] body) throws IOException {
        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(broker.channel).basicPublish(eq(""), eq(queue), eq(false), eq(false), props.capture(), eq(body));
        return props.getValue();
    }

    @Nested
    @DisplayName("Retry path")
    class RetryTests {

        @Test
        @DisplayName("First failure goes to the retry queue with count 1 and the requested backoff")
        void testFirstEscalation() throws Exception {
            Delivery delivery = MockBroker.delivery(7, Map.of(RetryMetadata.RETRY_TTL_HEADER, 1000), "{\"orderId\":1}");

            Escalation escalation = forwarder.escalate(delivery);

            assertThat(escalation).isEqualTo(new Escalation("orders.retry", 1, "1000", false));
            AMQP.BasicProperties props = publishedTo("orders.retry", delivery.getBody());
            assertThat(props.getHeaders())
                    .containsEntry(RetryMetadata.RETRY_COUNT_HEADER, 1)
                    .containsEntry(RetryMetadata.RETRY_TTL_HEADER, 1000);
            assertThat(props.getExpiration()).isEqualTo("1000");
            assertThat(props.getCorrelationId()).isEqualTo("corr-7");
            assertThat(props.getContentType()).isEqualTo("application/json");
            assertThat(props.getAppId()).isEqualTo("orders-api");
            verify(broker.channel).waitForConfirms();
        }

        @Test
        @DisplayName("Without a backoff header no per-message expiration is set")
        void testNoBackoffHeader() throws Exception {
            Delivery delivery = MockBroker.delivery(1, null, "body");

            Escalation escalation = forwarder.escalate(delivery);

            assertThat(escalation.expiration()).isNull();
            assertThat(publishedTo("orders.retry", delivery.getBody()).getExpiration()).isNull();
        }

        @Test
        @DisplayName("Should honour an explicit target queue while within budget")
        void testExplicitTarget() throws Exception {
            Delivery delivery = MockBroker.delivery(2, Map.of(RetryMetadata.RETRY_COUNT_HEADER, 1), "body");

            Escalation escalation = forwarder.escalate(delivery, "orders.slow");

            assertThat(escalation.targetQueue()).isEqualTo("orders.slow");
            assertThat(publishedTo("orders.slow", delivery.getBody()).getHeaders())
                    .containsEntry(RetryMetadata.RETRY_COUNT_HEADER, 2);
        }

        @Test
        @DisplayName("Should keep the original properties on the copy")
        void testOriginalPropertiesKept() throws Exception {
            Map<String, Object> headers = new HashMap<>();
            headers.put("trace-id", "t-1");
            Date sentAt = new Date(1_700_000_000_000L);
            AMQP.BasicProperties original = new AMQP.BasicProperties.Builder()
                    .headers(headers)
                    .messageId("m-1")
                    .replyTo("replies")
                    .timestamp(sentAt)
                    .deliveryMode(2)
                    .build();
            Delivery delivery = new Delivery(new Envelope(3, false, "", "orders"), original, "body".getBytes());

            forwarder.escalate(delivery);

            AMQP.BasicProperties props = publishedTo("orders.retry", delivery.getBody());
            assertThat(props.getHeaders()).containsEntry("trace-id", "t-1").containsEntry(RetryMetadata.RETRY_COUNT_HEADER, 1);
            assertThat(props.getMessageId()).isEqualTo("m-1");
            assertThat(props.getReplyTo()).isEqualTo("replies");
            assertThat(props.getTimestamp()).isEqualTo(sentAt);
            assertThat(props.getDeliveryMode()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Repeated escalation of one delivery")
    class RepeatedTests {

        private void assertSequence(Delivery delivery) throws Exception {
            for (int attempt = 1; attempt <= 3; attempt++) {
                Escalation escalation = forwarder.escalate(delivery);
                assertThat(escalation).isEqualTo(new Escalation("orders.retry", attempt, "1000", false));
            }
            Escalation last = forwarder.escalate(delivery);
            assertThat(last).isEqualTo(new Escalation("orders.dlq", 4, null, true));

            ArgumentCaptor<AMQP.BasicProperties> retried = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
            verify(broker.channel, times(3)).basicPublish(eq(""), eq("orders.retry"), eq(false), eq(false),
                    retried.capture(), eq(delivery.getBody()));
            assertThat(retried.getAllValues())
                    .extracting(p -> p.getHeaders().get(RetryMetadata.RETRY_COUNT_HEADER))
                    .containsExactly(1, 2, 3);
            assertThat(retried.getAllValues()).extracting(AMQP.BasicProperties::getExpiration)
                    .containsOnly("1000");

            AMQP.BasicProperties deadLettered = publishedTo("orders.dlq", delivery.getBody());
            assertThat(deadLettered.getHeaders()).containsEntry(RetryMetadata.RETRY_COUNT_HEADER, 4);
            assertThat(deadLettered.getExpiration()).isNull();
        }

        @Test
        @DisplayName("Counts 1 to 3 go to the retry queue and the fourth goes to the dead-letter queue")
        void testSequentialEscalation() throws Exception {
            Map<String, Object> headers = new HashMap<>();
            headers.put(RetryMetadata.RETRY_TTL_HEADER, 1000);
            Delivery delivery = MockBroker.delivery(11, headers, "{\"orderId\":11}");

            assertSequence(delivery);
        }

        @Test
        @DisplayName("Counting carries on for a delivery with read-only headers")
        void testReadOnlyHeaders() throws Exception {
            Delivery delivery = MockBroker.delivery(12, Map.of(RetryMetadata.RETRY_TTL_HEADER, 1000), "body");

            assertSequence(delivery);
            assertThat(delivery.getProperties().getHeaders()).doesNotContainKey(RetryMetadata.RETRY_COUNT_HEADER);
        }

        @Test
        @DisplayName("Counting carries on for a delivery without headers")
        void testNoHeaders() throws Exception {
            Delivery delivery = MockBroker.delivery(13, null, "body");

            for (int attempt = 1; attempt <= 3; attempt++) {
                assertThat(forwarder.escalate(delivery).retryCount()).isEqualTo(attempt);
            }
            assertThat(forwarder.escalate(delivery).targetQueue()).isEqualTo("orders.dlq");
        }
    }

    @Nested
    @DisplayName("Dead-letter path")
    class DeadLetterTests {

        @Test
        @DisplayName("Exhausted budget goes to the dead-letter queue without expiration")
        void testDeadLetter() throws Exception {
            Delivery delivery = MockBroker.delivery(9, Map.of(
                    RetryMetadata.RETRY_COUNT_HEADER, 3,
                    RetryMetadata.RETRY_TTL_HEADER, 1000), "poison");

            Escalation escalation = forwarder.escalate(delivery);

            assertThat(escalation.deadLettered()).isTrue();
            assertThat(escalation.targetQueue()).isEqualTo("orders.dlq");
            AMQP.BasicProperties props = publishedTo("orders.dlq", delivery.getBody());
            assertThat(props.getHeaders()).containsEntry(RetryMetadata.RETRY_COUNT_HEADER, 4);
            assertThat(props.getExpiration()).isNull();
        }

        @Test
        @DisplayName("An explicit target is ignored once the budget is spent")
        void testExplicitTargetIgnored() throws Exception {
            Delivery delivery = MockBroker.delivery(9, Map.of(RetryMetadata.RETRY_COUNT_HEADER, 5), "poison");

            assertThat(forwarder.escalate(delivery, "orders.slow").targetQueue()).isEqualTo("orders.dlq");
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Unreachable broker is reported as channel unavailable")
        void testChannelUnavailable() throws Exception {
            when(broker.factory.newConnection()).thenThrow(new IOException("refused"));

            assertThatThrownBy(() -> forwarder.escalate(MockBroker.delivery(1, null, "x")))
                    .isInstanceOf(ForwardException.class)
                    .satisfies(e -> assertThat(((ForwardException) e).getFailure())
                            .isEqualTo(DeliveryFailure.CHANNEL_UNAVAILABLE));
        }

        @Test
        @DisplayName("A publish error is reported as broker rejected")
        void testPublishError() throws Exception {
            doThrow(new IOException("no route"))
                    .when(broker.channel).basicPublish(anyString(), anyString(), anyBoolean(), anyBoolean(), any(), any());

            assertThatThrownBy(() -> forwarder.escalate(MockBroker.delivery(1, null, "x")))
                    .isInstanceOf(ForwardException.class)
                    .satisfies(e -> assertThat(((ForwardException) e).getFailure())
                            .isEqualTo(DeliveryFailure.BROKER_REJECTED));
        }

        @Test
        @DisplayName("A negative confirm is reported as broker rejected")
        void testNack() throws Exception {
            when(broker.channel.waitForConfirms()).thenReturn(false);

            assertThatThrownBy(() -> forwarder.escalate(MockBroker.delivery(1, null, "x")))
                    .isInstanceOf(ForwardException.class)
                    .satisfies(e -> assertThat(((ForwardException) e).getFailure())
                            .isEqualTo(DeliveryFailure.BROKER_REJECTED));
        }
    }
}
