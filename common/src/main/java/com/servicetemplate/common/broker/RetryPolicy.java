package com.servicetemplate.common.broker;

import java.util.Objects;

/**
 * The three-queue retry topology and its budget.
 * A message may pass through the retry queue {@code maxAttempts} times; the next escalation
 * sends it to the dead-letter queue.
 */
public final class RetryPolicy {

    public static final String RETRY_SUFFIX = ".retry";
    public static final String DEAD_LETTER_SUFFIX = ".dlq";

    private final String exchange;
    private final String mainQueue;
    private final String retryQueue;
    private final String deadLetterQueue;
    private final int retryDelayMillis;
    private final int maxAttempts;

    private RetryPolicy(Builder builder) {
        this.exchange = builder.exchange;
        this.mainQueue = builder.mainQueue;
        this.retryQueue = builder.retryQueue != null ? builder.retryQueue : builder.mainQueue + RETRY_SUFFIX;
        this.deadLetterQueue = builder.deadLetterQueue != null
                ? builder.deadLetterQueue : builder.mainQueue + DEAD_LETTER_SUFFIX;
        this.retryDelayMillis = builder.retryDelayMillis;
        this.maxAttempts = builder.maxAttempts;
    }

    public static Builder builder(String mainQueue) {
        return new Builder(mainQueue);
    }

    /**
     * Decides where the next copy of a failed message goes.
     *
     * @param next            metadata after the retry count was incremented
     * @param requestedTarget queue the caller asked for, normally the retry queue
     */
    public Escalation decide(RetryMetadata next, String requestedTarget) {
        if (next.getRetryCount() > maxAttempts || next.isSaturated()) {
            return new Escalation(deadLetterQueue, next.getRetryCount(), null, true);
        }
        String expiration = null;
        long ttl = next.getRetryTtlMillis().orElse(0L);
        if (ttl > 0) {
            expiration = Long.toString(ttl);
        }
        return new Escalation(requestedTarget, next.getRetryCount(), expiration, false);
    }

    /** Exchange the main queue is bound to; empty for the default exchange. */
    public String getExchange() {
        return exchange;
    }

    public String getMainQueue() {
        return mainQueue;
    }

    public String getRetryQueue() {
        return retryQueue;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    /** Queue-level TTL of the retry queue; applies to copies that carry no {@code X-Retry-TTL}. */
    public int getRetryDelayMillis() {
        return retryDelayMillis;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "exchange='" + exchange + '\'' +
                ", mainQueue='" + mainQueue + '\'' +
                ", retryQueue='" + retryQueue + '\'' +
                ", deadLetterQueue='" + deadLetterQueue + '\'' +
                ", retryDelayMillis=" + retryDelayMillis +
                ", maxAttempts=" + maxAttempts +
                '}';
    }

    public static final class Builder {
        private final String mainQueue;
        private String exchange = "";
        private String retryQueue;
        private String deadLetterQueue;
        private int retryDelayMillis = 30_000;
        private int maxAttempts = 3;

        private Builder(String mainQueue) {
            this.mainQueue = Objects.requireNonNull(mainQueue, "mainQueue");
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange == null ? "" : exchange;
            return this;
        }

        public Builder retryQueue(String retryQueue) {
            this.retryQueue = blankToNull(retryQueue);
            return this;
        }

        public Builder deadLetterQueue(String deadLetterQueue) {
            this.deadLetterQueue = blankToNull(deadLetterQueue);
            return this;
        }

        public Builder retryDelayMillis(int retryDelayMillis) {
            this.retryDelayMillis = retryDelayMillis;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (mainQueue.isBlank()) {
                throw new IllegalArgumentException("Main queue name must not be blank");
            }
            if (retryDelayMillis <= 0) {
                throw new IllegalArgumentException("Retry delay must be positive, got " + retryDelayMillis);
            }
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("Max attempts must not be negative, got " + maxAttempts);
            }
            RetryPolicy policy = new RetryPolicy(this);
            if (policy.retryQueue.equals(policy.mainQueue) || policy.deadLetterQueue.equals(policy.mainQueue)
                    || policy.retryQueue.equals(policy.deadLetterQueue)) {
                throw new IllegalArgumentException("Main, retry and dead-letter queues must be distinct: " + policy);
            }
            return policy;
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }
}
