package com.servicetemplate.common.broker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Connection parameters and the extra queues to provision.
 * Built once at startup and immutable afterwards.
 *
 * <pre>
 * BrokerConfig config = BrokerConfig.builder()
 *         .credentials("user", "pass")
 *         .host("rabbit.internal")
 *         .port(5672)
 *         .virtualHost("myapp")
 *         .queue(QueueSpec.builder("audit").autoDelete(true).build())
 *         .build();
 * </pre>
 */
public final class BrokerConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 5672;
    public static final String DEFAULT_VIRTUAL_HOST = "/";

    private static final int VISIBLE_PASSWORD_CHARS = 4;

    private final String username;
    private final String password;
    private final String host;
    private final int port;
    private final String virtualHost;
    private final boolean publisherConfirms;
    private final List<QueueSpec> queues;

    private BrokerConfig(Builder builder) {
        this.username = builder.username;
        this.password = builder.password;
        this.host = builder.host;
        this.port = builder.port;
        this.virtualHost = builder.virtualHost;
        this.publisherConfirms = builder.publisherConfirms;
        this.queues = Collections.unmodifiableList(new ArrayList<>(builder.queues));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
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

    /** Whether channels are put in confirm mode so every publish waits for the broker's ack. */
    public boolean isPublisherConfirms() {
        return publisherConfirms;
    }

    public List<QueueSpec> getQueues() {
        return queues;
    }

    /**
     * Connection URL safe for logs: the password is cut to its first four characters.
     */
    public String redactedUrl() {
        return String.format("amqp://%s:%s@%s:%d/%s", username, redact(password), host, port, virtualHost);
    }

    static String redact(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= VISIBLE_PASSWORD_CHARS) {
            return "...";
        }
        return secret.substring(0, VISIBLE_PASSWORD_CHARS) + "...";
    }

    @Override
    public String toString() {
        return "BrokerConfig{url='" + redactedUrl() + "', publisherConfirms=" + publisherConfirms
                + ", queues=" + queues + '}';
    }

    public static final class Builder {
        private String username = "";
        private String password = "";
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String virtualHost = DEFAULT_VIRTUAL_HOST;
        private boolean publisherConfirms = true;
        private final List<QueueSpec> queues = new ArrayList<>();

        private Builder() {}

        public Builder credentials(String username, String password) {
            this.username = username == null ? "" : username;
            this.password = password == null ? "" : password;
            return this;
        }

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid broker port: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder virtualHost(String virtualHost) {
            this.virtualHost = virtualHost == null || virtualHost.isBlank() ? DEFAULT_VIRTUAL_HOST : virtualHost;
            return this;
        }

        public Builder publisherConfirms(boolean publisherConfirms) {
            this.publisherConfirms = publisherConfirms;
            return this;
        }

        public Builder queue(QueueSpec queue) {
            this.queues.add(Objects.requireNonNull(queue, "queue"));
            return this;
        }

        public Builder queues(QueueSpec... queues) {
            for (QueueSpec queue : queues) {
                queue(queue);
            }
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(this);
        }
    }
}
