package com.servicetemplate.common.config;

import com.google.gson.annotations.SerializedName;
import com.servicetemplate.common.broker.BrokerConfig;
import com.servicetemplate.common.broker.QueueSpec;
import com.servicetemplate.common.broker.RetryPolicy;
import com.servicetemplate.common.util.Sensitive;

/**
 * Message broker section of the service configuration ({@code mq.*} keys).
 */
public class BrokerSettings {

    @SerializedName("MQ_ENABLED")
    private final boolean enabled;

    @SerializedName("MQ_HOST")
    private final String host;

    @SerializedName("MQ_PORT")
    private final int port;

    @SerializedName("MQ_VHOST")
    private final String virtualHost;

    @SerializedName("MQ_USERNAME")
    private final String username;

    @Sensitive
    @SerializedName("MQ_PASSWORD")
    private final String password;

    @SerializedName("MQ_EXCHANGE")
    private final String exchange;

    @SerializedName("MQ_QUEUE")
    private final String queue;

    @SerializedName("MQ_RETRY_QUEUE")
    private final String retryQueue;

    @SerializedName("MQ_DLQ")
    private final String deadLetterQueue;

    @SerializedName("MQ_RETRY_TTL")
    private final int retryTtlMillis;

    @SerializedName("MQ_RETRY_MAX_ATTEMPTS")
    private final int maxAttempts;

    @SerializedName("MQ_PUBLISHER_CONFIRMS")
    private final boolean publisherConfirms;

    @SerializedName("MQ_ARCHIVE_DIR")
    private final String archiveDir;

    BrokerSettings(ConfigSource source) {
        this.enabled = source.getBoolean("mq.enabled", true);
        this.host = source.get("mq.host", BrokerConfig.DEFAULT_HOST);
        this.port = source.getInt("mq.port", BrokerConfig.DEFAULT_PORT);
        this.virtualHost = source.get("mq.vhost", BrokerConfig.DEFAULT_VIRTUAL_HOST);
        this.username = source.get("mq.username", "");
        this.password = source.get("mq.password", "");
        this.exchange = source.get("mq.exchange", "");
        this.queue = source.get("mq.queue", "");
        this.retryQueue = source.get("mq.retry.queue", queue.isBlank() ? "" : queue + RetryPolicy.RETRY_SUFFIX);
        this.deadLetterQueue = source.get("mq.dlq", queue.isBlank() ? "" : queue + RetryPolicy.DEAD_LETTER_SUFFIX);
        this.retryTtlMillis = source.getInt("mq.retry.ttl", 30_000);
        this.maxAttempts = source.getInt("mq.retry.max.attempts", 3);
        this.publisherConfirms = source.getBoolean("mq.publisher.confirms", true);
        this.archiveDir = source.get("mq.archive.dir", "");
    }

    void validate() {
        if (!enabled) return;
        if (queue.isBlank()) {
            throw new ConfigException("MQ_QUEUE is required when the broker is enabled");
        }
        if (retryTtlMillis <= 0) {
            throw new ConfigException("MQ_RETRY_TTL must be a positive number of milliseconds, got " + retryTtlMillis);
        }
        if (maxAttempts < 0) {
            throw new ConfigException("MQ_RETRY_MAX_ATTEMPTS must not be negative, got " + maxAttempts);
        }
    }

    /**
     * Connection settings, plus any service-specific queues to declare alongside the retry topology.
     */
    public BrokerConfig toBrokerConfig(QueueSpec... extraQueues) {
        return BrokerConfig.builder()
                .credentials(username, password)
                .host(host)
                .port(port)
                .virtualHost(virtualHost)
                .publisherConfirms(publisherConfirms)
                .queues(extraQueues)
                .build();
    }

    public RetryPolicy toRetryPolicy() {
        try {
            return RetryPolicy.builder(queue)
                    .exchange(exchange)
                    .retryQueue(retryQueue)
                    .deadLetterQueue(deadLetterQueue)
                    .retryDelayMillis(retryTtlMillis)
                    .maxAttempts(maxAttempts)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid retry topology: " + e.getMessage(), e);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getExchange() {
        return exchange;
    }

    public String getQueue() {
        return queue;
    }

    public String getRetryQueue() {
        return retryQueue;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public int getRetryTtlMillis() {
        return retryTtlMillis;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isPublisherConfirms() {
        return publisherConfirms;
    }

    /** Directory for archived dead-lettered messages; empty when archiving is off. */
    public String getArchiveDir() {
        return archiveDir;
    }
}
