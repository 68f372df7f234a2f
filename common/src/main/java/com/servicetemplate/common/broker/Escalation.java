package com.servicetemplate.common.broker;

/**
 * Where an escalated message went and with which metadata.
 *
 * @param targetQueue  queue the copy was published to (through the default exchange)
 * @param retryCount   value written to {@code X-Retry-Count}
 * @param expiration   per-message expiration in milliseconds, or {@code null} for none
 * @param deadLettered whether the retry budget was exhausted
 */
public record Escalation(String targetQueue, int retryCount, String expiration, boolean deadLettered) {
}
