package com.servicetemplate.common.broker;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry bookkeeping carried in a message's header table.
 * Parsed from, and written back to, the generic header map at the engine boundary.
 */
public final class RetryMetadata {

    private static final Logger logger = LoggerFactory.getLogger(RetryMetadata.class);

    /** Number of escalations the message has gone through. Absent means 0. */
    public static final String RETRY_COUNT_HEADER = "X-Retry-Count";

    /** Backoff in milliseconds to hold the message in the retry queue. */
    public static final String RETRY_TTL_HEADER = "X-Retry-TTL";

    private static final RetryMetadata NONE = new RetryMetadata(0, null);

    private final int retryCount;
    private final Long retryTtlMillis;

    private RetryMetadata(int retryCount, Long retryTtlMillis) {
        this.retryCount = retryCount;
        this.retryTtlMillis = retryTtlMillis;
    }

    public static RetryMetadata none() {
        return NONE;
    }

    public static RetryMetadata of(int retryCount, Long retryTtlMillis) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count must not be negative: " + retryCount);
        }
        return new RetryMetadata(retryCount, retryTtlMillis);
    }

    /**
     * Reads the retry headers. Missing or unreadable values count as absent.
     */
    public static RetryMetadata fromHeaders(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) {
            return NONE;
        }
        Long count = readLong(headers, RETRY_COUNT_HEADER);
        Long ttl = readLong(headers, RETRY_TTL_HEADER);

        int retryCount = count == null ? 0 : (int) Math.max(0, Math.min(count, Integer.MAX_VALUE));
        return new RetryMetadata(retryCount, ttl);
    }

    private static Long readLong(Map<String, Object> headers, String name) {
        Object value = headers.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        // strings arrive as LongString from the client library
        String text = value.toString().trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            logger.warn("[MQEngine] Ignoring unreadable header {}={}", name, text);
            return null;
        }
    }

    /**
     * Metadata for the next escalation: retry count plus one, same backoff.
     * The count saturates at {@link Integer#MAX_VALUE}; a saturated count is always exhausted.
     */
    public RetryMetadata nextAttempt() {
        int next = retryCount == Integer.MAX_VALUE ? Integer.MAX_VALUE : retryCount + 1;
        return new RetryMetadata(next, retryTtlMillis);
    }

    public boolean isSaturated() {
        return retryCount == Integer.MAX_VALUE;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public OptionalLong getRetryTtlMillis() {
        return retryTtlMillis == null ? OptionalLong.empty() : OptionalLong.of(retryTtlMillis);
    }

    /**
     * Writes the retry count into {@code headers} in place.
     *
     * @return {@code headers}, or a new map holding only the count when {@code headers} is null
     * @throws UnsupportedOperationException if {@code headers} is read-only
     */
    public Map<String, Object> writeTo(Map<String, Object> headers) {
        Map<String, Object> target = headers == null ? new HashMap<>() : headers;
        target.put(RETRY_COUNT_HEADER, retryCount);
        return target;
    }

    @Override
    public String toString() {
        return "RetryMetadata{retryCount=" + retryCount + ", retryTtlMillis=" + retryTtlMillis + '}';
    }
}
