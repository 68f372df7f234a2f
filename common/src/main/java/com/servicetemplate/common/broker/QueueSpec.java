package com.servicetemplate.common.broker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of one queue to provision, and optionally the exchange it is bound to.
 * Immutable; build with {@link #builder(String)}.
 */
public final class QueueSpec {

    private final String name;
    private final String exchange;
    private final String routingKey;
    private final boolean durable;
    private final boolean autoDelete;
    private final boolean exclusive;
    private final boolean noWait;
    private final Map<String, Object> arguments;

    private QueueSpec(Builder builder) {
        this.name = builder.name;
        this.exchange = builder.exchange;
        this.routingKey = builder.routingKey;
        this.durable = builder.durable;
        this.autoDelete = builder.autoDelete;
        this.exclusive = builder.exclusive;
        this.noWait = builder.noWait;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.arguments));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /** Exchange to bind to; empty when the queue is only reachable through the default exchange. */
    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    /** Routing key used for the binding: the configured key, or the queue name when none was given. */
    public String effectiveRoutingKey() {
        return routingKey.isEmpty() ? name : routingKey;
    }

    public boolean isBound() {
        return !exchange.isEmpty();
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isNoWait() {
        return noWait;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return "QueueSpec{" +
                "name='" + name + '\'' +
                ", exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", durable=" + durable +
                ", autoDelete=" + autoDelete +
                ", exclusive=" + exclusive +
                ", noWait=" + noWait +
                ", arguments=" + arguments +
                '}';
    }

    public static final class Builder {
        private final String name;
        private String exchange = "";
        private String routingKey = "";
        private boolean durable = true;
        private boolean autoDelete;
        private boolean exclusive;
        private boolean noWait;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange == null ? "" : exchange;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey == null ? "" : routingKey;
            return this;
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder noWait(boolean noWait) {
            this.noWait = noWait;
            return this;
        }

        public Builder argument(String key, Object value) {
            this.arguments.put(key, value);
            return this;
        }

        /** Replaces all arguments set so far. */
        public Builder arguments(Map<String, Object> arguments) {
            this.arguments.clear();
            if (arguments != null) {
                this.arguments.putAll(arguments);
            }
            return this;
        }

        public QueueSpec build() {
            if (name.isBlank()) {
                throw new IllegalArgumentException("Queue name must not be blank");
            }
            return new QueueSpec(this);
        }
    }
}
