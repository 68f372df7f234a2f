package com.servicetemplate.common.broker;

import static org.assertj.core.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Retry policy")
class RetryPolicyTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should derive retry and dead-letter queue names from the main queue")
        void testDefaultNames() {
            RetryPolicy policy = RetryPolicy.builder("orders").build();

            assertThat(policy.getMainQueue()).isEqualTo("orders");
            assertThat(policy.getRetryQueue()).isEqualTo("orders.retry");
            assertThat(policy.getDeadLetterQueue()).isEqualTo("orders.dlq");
            assertThat(policy.getExchange()).isEmpty();
            assertThat(policy.getRetryDelayMillis()).isEqualTo(30_000);
            assertThat(policy.getMaxAttempts()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should reject queues that share a name")
        void testDistinctQueues() {
            assertThatThrownBy(() -> RetryPolicy.builder("orders").retryQueue("orders").build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RetryPolicy.builder("orders").deadLetterQueue("orders.retry").build())
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject a non-positive delay and a negative budget")
        void testInvalidNumbers() {
            assertThatThrownBy(() -> RetryPolicy.builder("orders").retryDelayMillis(0).build())
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RetryPolicy.builder("orders").maxAttempts(-1).build())
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Escalation decisions")
    class DecisionTests {

        private final RetryPolicy policy = RetryPolicy.builder("orders").maxAttempts(2).build();

        @Test
        @DisplayName("Should keep the requested target while the budget lasts")
        void testWithinBudget() {
            for (int count = 1; count <= 2; count++) {
                Escalation escalation = policy.decide(RetryMetadata.of(count, null), "orders.retry");

                assertThat(escalation.targetQueue()).isEqualTo("orders.retry");
                assertThat(escalation.deadLettered()).isFalse();
                assertThat(escalation.retryCount()).isEqualTo(count);
            }
        }

        @Test
        @DisplayName("Should dead-letter once the count exceeds the budget")
        void testBudgetExhausted() {
            Escalation escalation = policy.decide(RetryMetadata.of(3, 1000L), "orders.retry");

            assertThat(escalation.targetQueue()).isEqualTo("orders.dlq");
            assertThat(escalation.deadLettered()).isTrue();
            assertThat(escalation.expiration()).isNull();
        }

        @Test
        @DisplayName("Zero attempts sends the first failure straight to the dead-letter queue")
        void testZeroBudget() {
            RetryPolicy none = RetryPolicy.builder("orders").maxAttempts(0).build();

            assertThat(none.decide(RetryMetadata.none().nextAttempt(), "orders.retry").deadLettered()).isTrue();
        }

        @Test
        @DisplayName("The largest budget still retries a first failure")
        void testLargestBudget() {
            RetryPolicy unbounded = RetryPolicy.builder("orders").maxAttempts(Integer.MAX_VALUE).build();

            Escalation escalation = unbounded.decide(RetryMetadata.none().nextAttempt(), "orders.retry");

            assertThat(escalation.targetQueue()).isEqualTo("orders.retry");
            assertThat(escalation.deadLettered()).isFalse();
            assertThat(escalation.retryCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A saturated count is dead-lettered rather than retried with a wrapped count")
        void testSaturatedCount() {
            RetryMetadata next = RetryMetadata.fromHeaders(
                    Map.of(RetryMetadata.RETRY_COUNT_HEADER, Integer.MAX_VALUE)).nextAttempt();

            Escalation escalation = policy.decide(next, "orders.retry");

            assertThat(escalation.targetQueue()).isEqualTo("orders.dlq");
            assertThat(escalation.deadLettered()).isTrue();
            assertThat(escalation.retryCount()).isEqualTo(Integer.MAX_VALUE);
        }

        @Test
        @DisplayName("Per-message expiration comes from a positive backoff only")
        void testExpiration() {
            assertThat(policy.decide(RetryMetadata.of(1, 2500L), "orders.retry").expiration()).isEqualTo("2500");
            assertThat(policy.decide(RetryMetadata.of(1, 0L), "orders.retry").expiration()).isNull();
            assertThat(policy.decide(RetryMetadata.of(1, null), "orders.retry").expiration()).isNull();
        }
    }
}
